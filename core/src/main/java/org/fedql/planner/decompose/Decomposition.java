/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.decompose;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.fedql.planner.query.OperationType;

/**
 * Output of {@link QueryDecomposer}: fragments in discovery order plus, per fragment, the indices
 * of the fragments it waits for. A fragment is only discovered after every fragment it depends
 * on, so the list is already in topological order.
 */
@EqualsAndHashCode
@ToString
public class Decomposition {

  private final OperationType operationType;
  private final ImmutableList<FetchFragment> fragments;
  private final ImmutableList<ImmutableSortedSet<Integer>> dependencies;

  public Decomposition(
      OperationType operationType,
      List<FetchFragment> fragments,
      List<ImmutableSortedSet<Integer>> dependencies) {
    Preconditions.checkArgument(
        fragments.size() == dependencies.size(),
        "every fragment needs a dependency set, got %s fragments and %s sets",
        fragments.size(),
        dependencies.size());
    this.operationType = operationType;
    this.fragments = ImmutableList.copyOf(fragments);
    this.dependencies = ImmutableList.copyOf(dependencies);
  }

  public OperationType getOperationType() {
    return operationType;
  }

  public List<FetchFragment> getFragments() {
    return fragments;
  }

  public FetchFragment getFragment(int index) {
    return fragments.get(index);
  }

  /** Returns the indices of the fragments {@code index} depends on. */
  public ImmutableSortedSet<Integer> getDependencies(int index) {
    return dependencies.get(index);
  }

  public int size() {
    return fragments.size();
  }
}
