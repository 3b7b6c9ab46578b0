/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.exception;

import org.fedql.planner.query.ResponsePath;

/** A selection set spans sources and nothing bridges them on the given type. */
public class UngroupableSelectionException extends QueryPlanningException {

  public UngroupableSelectionException(String message, String typeName, ResponsePath path) {
    super(message, typeName, path);
  }
}
