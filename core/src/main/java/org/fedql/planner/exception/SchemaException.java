/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.exception;

/** Malformed ownership or entity key declarations, raised while building a schema index. */
public class SchemaException extends QueryPlanningException {

  public SchemaException(String message) {
    super(message, null, null);
  }

  public SchemaException(String message, String typeName) {
    super(message, typeName, null);
  }
}
