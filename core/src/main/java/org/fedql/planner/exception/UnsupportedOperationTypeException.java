/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.exception;

import org.fedql.planner.query.OperationType;

/** Operation kinds the planner refuses to plan, currently subscriptions. */
public class UnsupportedOperationTypeException extends QueryPlanningException {

  public UnsupportedOperationTypeException(OperationType operationType, String rootType) {
    super(
        String.format("Query planning does not support %s operations", operationType),
        rootType,
        null);
  }
}
