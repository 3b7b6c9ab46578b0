/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.merge;

import lombok.Value;

/** A field of the parent result passed to a dependent fetch as an argument. */
@Value
public class KeyForwarding {
  String sourceFieldName;
  String destinationArgumentName;

  @Override
  public String toString() {
    return sourceFieldName + " -> " + destinationArgumentName;
  }
}
