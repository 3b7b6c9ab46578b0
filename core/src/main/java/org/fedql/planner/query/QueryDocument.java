/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.Value;

/** A validated operation: its kind, its root type and the root selection set. */
@Value
public class QueryDocument {
  @NonNull OperationType operationType;
  @NonNull String rootType;
  @NonNull List<SelectionNode> selections;

  public QueryDocument(
      @NonNull OperationType operationType,
      @NonNull String rootType,
      @NonNull List<SelectionNode> selections) {
    this.operationType = operationType;
    this.rootType = rootType;
    this.selections = ImmutableList.copyOf(selections);
  }

  public static QueryDocument query(String rootType, Consumer<SelectionSetBuilder> body) {
    return of(OperationType.QUERY, rootType, body);
  }

  public static QueryDocument mutation(String rootType, Consumer<SelectionSetBuilder> body) {
    return of(OperationType.MUTATION, rootType, body);
  }

  public static QueryDocument subscription(String rootType, Consumer<SelectionSetBuilder> body) {
    return of(OperationType.SUBSCRIPTION, rootType, body);
  }

  private static QueryDocument of(
      OperationType operationType, String rootType, Consumer<SelectionSetBuilder> body) {
    SelectionSetBuilder builder = new SelectionSetBuilder(ResponsePath.ROOT, rootType);
    body.accept(builder);
    return new QueryDocument(operationType, rootType, builder.build());
  }
}
