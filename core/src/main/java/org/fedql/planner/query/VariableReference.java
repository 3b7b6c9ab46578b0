/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.query;

import lombok.Value;

/** Argument value bound to an operation variable rather than a literal. */
@Value
public class VariableReference {
  String name;

  @Override
  public String toString() {
    return "$" + name;
  }
}
