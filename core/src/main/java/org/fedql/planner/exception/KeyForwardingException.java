/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.exception;

import lombok.Getter;
import org.fedql.planner.query.ResponsePath;

/** An entity key field cannot be mapped to an argument of the child source's re-entry point. */
@Getter
public class KeyForwardingException extends QueryPlanningException {

  private final String sourceId;

  public KeyForwardingException(
      String message, String typeName, String sourceId, ResponsePath path) {
    super(message, typeName, path);
    this.sourceId = sourceId;
  }
}
