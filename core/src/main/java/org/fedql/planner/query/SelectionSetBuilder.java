/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fluent builder of a selection set that derives response paths and parent types. Meant for front
 * ends that resolve field types but do not track paths, and for tests.
 *
 * <pre>
 * QueryDocument.query("Query", q -&gt; q
 *     .object("me", "User", me -&gt; me
 *         .field("id")
 *         .list("reviews", "Review", r -&gt; r.field("body"))));
 * </pre>
 */
public class SelectionSetBuilder {

  private final ResponsePath path;
  private final String onType;
  private final ImmutableList.Builder<SelectionNode> selections = ImmutableList.builder();

  SelectionSetBuilder(ResponsePath path, String onType) {
    this.path = path;
    this.onType = onType;
  }

  /** Adds a leaf field. */
  public SelectionSetBuilder field(String name) {
    return field(null, name, Map.of());
  }

  /** Adds an aliased leaf field with arguments. */
  public SelectionSetBuilder field(String alias, String name, Map<String, ?> arguments) {
    selections.add(leaf(alias, name, arguments));
    return this;
  }

  /** Adds a field returning a single object of {@code type}. */
  public SelectionSetBuilder object(
      String name, String type, Consumer<SelectionSetBuilder> body) {
    return object(null, name, Map.of(), type, body);
  }

  public SelectionSetBuilder object(
      String alias,
      String name,
      Map<String, ?> arguments,
      String type,
      Consumer<SelectionSetBuilder> body) {
    selections.add(composite(alias, name, arguments, type, false, body));
    return this;
  }

  /** Adds a field returning a list of {@code type}. */
  public SelectionSetBuilder list(String name, String type, Consumer<SelectionSetBuilder> body) {
    return list(null, name, Map.of(), type, body);
  }

  public SelectionSetBuilder list(
      String alias,
      String name,
      Map<String, ?> arguments,
      String type,
      Consumer<SelectionSetBuilder> body) {
    selections.add(composite(alias, name, arguments, type, true, body));
    return this;
  }

  List<SelectionNode> build() {
    return selections.build();
  }

  private SelectionNode leaf(String alias, String name, Map<String, ?> arguments) {
    String responseKey = alias != null ? alias : name;
    return SelectionNode.builder()
        .fieldName(name)
        .alias(alias)
        .arguments(arguments)
        .responsePath(path.append(responseKey))
        .onType(onType)
        .build();
  }

  private SelectionNode composite(
      String alias,
      String name,
      Map<String, ?> arguments,
      String type,
      boolean list,
      Consumer<SelectionSetBuilder> body) {
    String responseKey = alias != null ? alias : name;
    ResponsePath fieldPath = path.append(responseKey);
    SelectionSetBuilder nested = new SelectionSetBuilder(fieldPath, type);
    body.accept(nested);
    return SelectionNode.builder()
        .fieldName(name)
        .alias(alias)
        .arguments(arguments)
        .responsePath(fieldPath)
        .onType(onType)
        .list(list)
        .children(nested.build())
        .build();
  }
}
