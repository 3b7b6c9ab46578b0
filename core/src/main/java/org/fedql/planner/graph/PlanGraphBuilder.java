/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.fedql.planner.decompose.Decomposition;
import org.fedql.planner.decompose.FetchFragment;
import org.fedql.planner.merge.MergeSpec;
import org.fedql.planner.merge.MergeSpecEmitter;
import org.fedql.planner.plan.Plan;
import org.fedql.planner.plan.PlanNode;
import org.fedql.planner.query.ResponsePath;

/**
 * Turns a {@link Decomposition} into a {@link Plan}. Fragment {@code i} becomes node {@code i};
 * the decomposition is already topologically ordered, so no cycle check is needed.
 *
 * <p>Nodes that target the same source, wait for exactly the same nodes and are of the same kind
 * (root or entity fetch) are batch siblings: they become ready together and an executor may send
 * them as one request.
 */
@Log4j2
@RequiredArgsConstructor
public class PlanGraphBuilder {

  private final MergeSpecEmitter mergeSpecEmitter;

  public Plan build(Decomposition decomposition) {
    Map<BatchKey, List<Integer>> batches = new LinkedHashMap<>();
    for (int id = 0; id < decomposition.size(); id++) {
      batches
          .computeIfAbsent(
              BatchKey.of(decomposition.getFragment(id), decomposition.getDependencies(id)),
              key -> new ArrayList<>())
          .add(id);
    }

    ImmutableMap.Builder<Integer, PlanNode> nodes = ImmutableMap.builder();
    ImmutableMap.Builder<Integer, MergeSpec> mergeSpecs = ImmutableMap.builder();
    for (int id = 0; id < decomposition.size(); id++) {
      FetchFragment fragment = decomposition.getFragment(id);
      ImmutableSortedSet<Integer> dependsOn = decomposition.getDependencies(id);
      int self = id;
      ImmutableSortedSet<Integer> siblings =
          batches.get(BatchKey.of(fragment, dependsOn)).stream()
              .filter(other -> other != self)
              .collect(ImmutableSortedSet.toImmutableSortedSet(Integer::compare));

      nodes.put(id, new PlanNode(id, fragment.getSourceId(), fragment, dependsOn, siblings));
      mergeSpecs.put(id, mergeSpecEmitter.emit(fragment));
    }

    Plan plan =
        new Plan(
            decomposition.getOperationType(),
            nodes.build(),
            ResponsePath.ROOT,
            mergeSpecs.build());
    log.debug("Built plan graph with {} nodes in {} batches", plan.getNodeCount(), batches.size());
    return plan;
  }

  /** Root fetches, mutations among them, are never batched with entity fetches. */
  @Value
  private static class BatchKey {
    String sourceId;
    ImmutableSortedSet<Integer> dependsOn;
    boolean entityFetch;

    static BatchKey of(FetchFragment fragment, ImmutableSortedSet<Integer> dependsOn) {
      return new BatchKey(fragment.getSourceId(), dependsOn, fragment.isEntityFetch());
    }
  }
}
