/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.exception;

import lombok.Getter;
import org.fedql.planner.query.ResponsePath;

/**
 * Base class of every failure raised while indexing a schema or planning a query. Planning
 * failures are deterministic for a given (query, schema) pair, so callers never retry them.
 */
@Getter
public class QueryPlanningException extends RuntimeException {

  /** Type the failure was detected on, or null when not type specific. */
  private final String typeName;

  /** Response path of the offending selection, or null when raised outside of planning. */
  private final ResponsePath responsePath;

  public QueryPlanningException(String message, String typeName, ResponsePath responsePath) {
    super(message);
    this.typeName = typeName;
    this.responsePath = responsePath;
  }
}
