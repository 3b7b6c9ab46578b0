/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.config;

/** How the decomposer picks a source for a field that several sources can resolve. */
public enum OwnerSelectionPolicy {

  /**
   * Take the first-listed owner of each field. Entity key fields the parent can resolve stay in
   * the parent, which selects them for the dependent fetches anyway.
   */
  DECLARATION_ORDER,

  /**
   * Keep fields in the parent fragment whenever its source can resolve them, then prefer a single
   * source covering all remaining fields, then the first-listed owner.
   */
  PREFER_PARENT_SOURCE
}
