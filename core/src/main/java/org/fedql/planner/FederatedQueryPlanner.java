/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.fedql.planner.config.PlannerSettings;
import org.fedql.planner.decompose.Decomposition;
import org.fedql.planner.decompose.QueryDecomposer;
import org.fedql.planner.exception.QueryPlanningException;
import org.fedql.planner.graph.PlanGraphBuilder;
import org.fedql.planner.merge.MergeSpecEmitter;
import org.fedql.planner.plan.Plan;
import org.fedql.planner.plan.PlanPrinter;
import org.fedql.planner.query.QueryDocument;
import org.fedql.planner.schema.SchemaIndex;

/**
 * Default {@link QueryPlanner}. Planning runs in two passes over the query:
 *
 * <ol>
 *   <li><strong>Decomposition</strong>: {@link QueryDecomposer} splits the selection tree into
 *       per-source fragments and records which fragment waits for which
 *   <li><strong>Graph building</strong>: {@link PlanGraphBuilder} turns the fragments into plan
 *       nodes, batches siblings and attaches a merge spec to every node
 * </ol>
 *
 * <pre>
 * query { topProducts { name reviews { body author { name } } } }
 *
 * Wave 0: products  topProducts { name upc }
 * Wave 1: reviews   at topProducts.@   reviews { body author { id } }   forwarding [upc -&gt; upc]
 * Wave 2: accounts  at topProducts.@.reviews.@.author   name            forwarding [id -&gt; id]
 * </pre>
 */
@Log4j2
@RequiredArgsConstructor
public class FederatedQueryPlanner implements QueryPlanner {

  @Getter private final PlannerSettings settings;

  @Override
  public Plan plan(QueryDocument document, SchemaIndex schemaIndex) {
    try {
      Decomposition decomposition = new QueryDecomposer(schemaIndex, settings).decompose(document);
      Plan plan =
          new PlanGraphBuilder(new MergeSpecEmitter(schemaIndex, settings)).build(decomposition);
      log.info(
          "Created {} plan on {} with {} nodes in {} waves",
          document.getOperationType(),
          document.getRootType(),
          plan.getNodeCount(),
          plan.getWaves().size());
      if (log.isDebugEnabled()) {
        log.debug("Plan:\n{}", PlanPrinter.print(plan));
      }
      return plan;
    } catch (QueryPlanningException e) {
      log.debug("Failed to plan {} on {}", document.getOperationType(), document.getRootType(), e);
      throw e;
    }
  }
}
