/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.decompose;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Value;
import org.fedql.planner.query.ResponsePath;
import org.fedql.planner.query.SelectionNode;

/**
 * The part of a query assigned to one source: the minimal selection that source has to resolve,
 * the entity key values it has to be handed, and the path its result attaches at.
 */
@Value
public class FetchFragment {

  String sourceId;

  /** Type of the selection set at {@link #providedPath}. */
  String typeName;

  /** Selection set fetched from the source, including injected key fields. */
  ImmutableList<SelectionNode> selection;

  /** Fields handed to the source to re-enter the entity. Empty for root fragments. */
  ImmutableList<String> requiredKeys;

  ResponsePath providedPath;

  /** Variables referenced by arguments in {@link #selection}, sorted. */
  ImmutableList<String> variableUsages;

  public boolean isEntityFetch() {
    return !requiredKeys.isEmpty();
  }

  /** Finds the selected field with the given response path, searching nested selections. */
  public Optional<SelectionNode> findField(ResponsePath responsePath) {
    return find(selection, responsePath);
  }

  /** Counts the selected fields, nested ones included. */
  public int fieldCount() {
    return count(selection);
  }

  private static Optional<SelectionNode> find(List<SelectionNode> nodes, ResponsePath path) {
    for (SelectionNode node : nodes) {
      if (node.getResponsePath().equals(path)) {
        return Optional.of(node);
      }
      if (path.startsWith(node.getResponsePath())) {
        Optional<SelectionNode> nested = find(node.getChildren(), path);
        if (nested.isPresent()) {
          return nested;
        }
      }
    }
    return Optional.empty();
  }

  private static int count(List<SelectionNode> nodes) {
    int total = 0;
    for (SelectionNode node : nodes) {
      total += 1 + count(node.getChildren());
    }
    return total;
  }
}
