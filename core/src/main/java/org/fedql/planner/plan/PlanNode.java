/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.plan;

import com.google.common.collect.ImmutableSortedSet;
import lombok.Value;
import org.fedql.planner.decompose.FetchFragment;

/** One fetch of a plan. Ids are indices into the plan, stable for its lifetime. */
@Value
public class PlanNode {

  int id;

  String sourceId;

  FetchFragment fragment;

  /** Nodes whose results must be available before this fetch is issued. */
  ImmutableSortedSet<Integer> dependsOn;

  /** Other nodes of the same wave and source that may be sent with this one. */
  ImmutableSortedSet<Integer> batchSiblings;

  public boolean isRoot() {
    return dependsOn.isEmpty();
  }
}
