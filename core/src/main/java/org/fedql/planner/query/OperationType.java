/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.query;

/** Kind of operation a query document carries. */
public enum OperationType {
  QUERY,

  /** Root fields execute in declared order, see the decomposer's serial split. */
  MUTATION,

  SUBSCRIPTION
}
