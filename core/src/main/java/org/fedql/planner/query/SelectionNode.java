/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.query;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One field of a validated query, as handed over by the query front end. The planner trusts the
 * tree to be type correct and only reads it.
 */
@Value
@Builder(toBuilder = true)
public class SelectionNode {

  public static final String TYPENAME = "__typename";

  @NonNull String fieldName;

  /** Alias requested by the query, null when the field is not aliased. */
  String alias;

  @Singular Map<String, Object> arguments;

  /** Response keys from the query root down to and including this field. */
  @NonNull ResponsePath responsePath;

  @Singular List<SelectionNode> children;

  /** Type this field is selected on. */
  @NonNull String onType;

  /** True when the field returns a list. */
  boolean list;

  public String getResponseKey() {
    return alias != null ? alias : fieldName;
  }

  public boolean isComposite() {
    return !children.isEmpty();
  }

  public boolean isTypename() {
    return TYPENAME.equals(fieldName);
  }

  /** Copy of this node with its children replaced. */
  public SelectionNode withChildren(List<SelectionNode> newChildren) {
    return toBuilder().clearChildren().children(newChildren).build();
  }
}
