/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner;

import org.fedql.planner.plan.Plan;
import org.fedql.planner.query.QueryDocument;
import org.fedql.planner.schema.SchemaIndex;

/** Plans a validated query against a federated schema. */
public interface QueryPlanner {

  /**
   * Builds the execution plan of a query.
   *
   * @param document validated query document.
   * @param schemaIndex ownership-annotated schema the query was validated against.
   * @return immutable plan.
   * @throws org.fedql.planner.exception.QueryPlanningException if no plan can be built.
   */
  Plan plan(QueryDocument document, SchemaIndex schemaIndex);
}
