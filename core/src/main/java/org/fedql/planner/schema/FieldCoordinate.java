/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import lombok.Value;

/** A (type, field) pair. */
@Value
public class FieldCoordinate {
  String typeName;
  String fieldName;

  public static FieldCoordinate of(String typeName, String fieldName) {
    return new FieldCoordinate(typeName, fieldName);
  }

  @Override
  public String toString() {
    return typeName + "." + fieldName;
  }
}
