/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.plan;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import org.fedql.planner.merge.KeyForwarding;
import org.fedql.planner.merge.MergeSpec;
import org.fedql.planner.query.OperationType;
import org.fedql.planner.query.ResponsePath;

/**
 * The immutable output of planning: a DAG of fetches plus the instructions to merge their
 * results. An executor issues every node of a wave in parallel, forwards key values to the nodes
 * of the next wave and splices each result at its merge spec's attach path.
 *
 * <p>Waves are not stored; they follow from {@code dependsOn}. Every dependency of a node has a
 * smaller id, so iterating nodes in id order is a valid execution order.
 */
@EqualsAndHashCode
public class Plan {

  private final OperationType operationType;
  private final ImmutableMap<Integer, PlanNode> nodes;
  private final ResponsePath rootPath;
  private final ImmutableMap<Integer, MergeSpec> mergeSpecs;

  public Plan(
      OperationType operationType,
      Map<Integer, PlanNode> nodes,
      ResponsePath rootPath,
      Map<Integer, MergeSpec> mergeSpecs) {
    this.operationType = operationType;
    this.nodes = ImmutableMap.copyOf(nodes);
    this.rootPath = rootPath;
    this.mergeSpecs = ImmutableMap.copyOf(mergeSpecs);
  }

  public OperationType getOperationType() {
    return operationType;
  }

  /** Returns all nodes by id, in id order. */
  public Map<Integer, PlanNode> getNodes() {
    return nodes;
  }

  public ResponsePath getRootPath() {
    return rootPath;
  }

  public Map<Integer, MergeSpec> getMergeSpecs() {
    return mergeSpecs;
  }

  /** Returns a node by its id. */
  public PlanNode getNode(int id) {
    PlanNode node = nodes.get(id);
    if (node == null) {
      throw new IllegalArgumentException("Plan node not found: " + id);
    }
    return node;
  }

  public MergeSpec getMergeSpec(int id) {
    MergeSpec mergeSpec = mergeSpecs.get(id);
    if (mergeSpec == null) {
      throw new IllegalArgumentException("Merge spec not found for node: " + id);
    }
    return mergeSpec;
  }

  public int getNodeCount() {
    return nodes.size();
  }

  /** Returns nodes without dependencies. */
  public List<PlanNode> getRootNodes() {
    return nodes.values().stream().filter(PlanNode::isRoot).collect(Collectors.toList());
  }

  /** Returns the wave of a node: 0 without dependencies, else one after its latest dependency. */
  public int getWave(int id) {
    return computeWaves().get(getNode(id).getId());
  }

  /** Returns the nodes grouped by wave, waves in execution order and nodes in id order. */
  public List<List<PlanNode>> getWaves() {
    Map<Integer, Integer> waves = computeWaves();
    List<List<PlanNode>> grouped = new ArrayList<>();
    for (PlanNode node : nodes.values()) {
      int wave = waves.get(node.getId());
      while (grouped.size() <= wave) {
        grouped.add(new ArrayList<>());
      }
      grouped.get(wave).add(node);
    }
    return grouped.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList());
  }

  /**
   * Validates the plan structure. Returns a list of errors, or an empty list if valid.
   *
   * @return list of error messages
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    nodes.forEach(
        (id, node) -> {
          if (id != node.getId()) {
            errors.add("Node " + node.getId() + " is registered under id " + id);
          }
          if (!mergeSpecs.containsKey(id)) {
            errors.add("Node " + id + " has no merge spec");
          }
          for (int dependency : node.getDependsOn()) {
            if (!nodes.containsKey(dependency)) {
              errors.add("Node " + id + " depends on unknown node: " + dependency);
            } else if (dependency >= id) {
              errors.add("Node " + id + " depends on later node: " + dependency);
            }
          }
          for (int sibling : node.getBatchSiblings()) {
            PlanNode other = nodes.get(sibling);
            if (other == null) {
              errors.add("Node " + id + " is batched with unknown node: " + sibling);
            } else if (sibling == id
                || !other.getSourceId().equals(node.getSourceId())
                || !other.getDependsOn().equals(node.getDependsOn())
                || other.getFragment().isEntityFetch() != node.getFragment().isEntityFetch()) {
              errors.add("Node " + id + " cannot be batched with node " + sibling);
            }
          }
        });
    mergeSpecs.forEach(
        (id, mergeSpec) -> {
          if (nodes.containsKey(id)) {
            validateKeyForwarding(nodes.get(id), mergeSpec, errors);
          } else {
            errors.add("Merge spec for unknown node: " + id);
          }
        });
    return errors;
  }

  /** Every forwarded field must be selected by one of the node's dependencies. */
  private void validateKeyForwarding(PlanNode node, MergeSpec mergeSpec, List<String> errors) {
    ResponsePath parentPath = mergeSpec.getAttachPath().withoutListMarkers();
    for (KeyForwarding forwarding : mergeSpec.getKeyForwarding()) {
      ResponsePath fieldPath = parentPath.append(forwarding.getSourceFieldName());
      boolean provided =
          node.getDependsOn().stream()
              .map(nodes::get)
              .filter(Objects::nonNull)
              .anyMatch(dependency -> dependency.getFragment().findField(fieldPath).isPresent());
      if (!provided) {
        errors.add(
            "Node " + node.getId() + " forwards " + fieldPath + " which no dependency selects");
      }
    }
  }

  private Map<Integer, Integer> computeWaves() {
    Map<Integer, Integer> waves = new HashMap<>();
    for (PlanNode node : nodes.values()) {
      int wave = 0;
      for (int dependency : node.getDependsOn()) {
        wave = Math.max(wave, waves.getOrDefault(dependency, 0) + 1);
      }
      waves.put(node.getId(), wave);
    }
    return waves;
  }

  @Override
  public String toString() {
    return "Plan{operation=" + operationType + ", nodes=" + nodes.size() + '}';
  }
}
