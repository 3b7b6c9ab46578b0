/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.plan;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.fedql.planner.merge.MergeSpec;
import org.fedql.planner.query.SelectionNode;

/**
 * Renders a plan as indented text, wave by wave, for logs and diagnostics.
 *
 * <pre>
 * Plan(QUERY) {
 *   Wave 0 {
 *     Fetch #0 accounts at &lt;root&gt; {
 *       me { id name }
 *     }
 *   }
 *   Wave 1 {
 *     Fetch #1 reviews at me after [0] forwarding [id -&gt; id] {
 *       reviews { body }
 *     }
 *   }
 * }
 * </pre>
 */
public final class PlanPrinter {

  private static final String INDENT = "  ";

  private PlanPrinter() {}

  public static String print(Plan plan) {
    StringBuilder sb = new StringBuilder();
    sb.append("Plan(").append(plan.getOperationType()).append(") {\n");
    List<List<PlanNode>> waves = plan.getWaves();
    for (int wave = 0; wave < waves.size(); wave++) {
      sb.append(INDENT).append("Wave ").append(wave).append(" {\n");
      for (PlanNode node : waves.get(wave)) {
        printNode(sb, node, plan.getMergeSpec(node.getId()));
      }
      sb.append(INDENT).append("}\n");
    }
    return sb.append('}').toString();
  }

  /** Renders a selection set on a single line, e.g. {@code me { id name }}. */
  public static String printSelection(List<SelectionNode> selection) {
    return selection.stream().map(PlanPrinter::printField).collect(Collectors.joining(" "));
  }

  private static void printNode(StringBuilder sb, PlanNode node, MergeSpec mergeSpec) {
    String indent = INDENT + INDENT;
    sb.append(indent)
        .append("Fetch #")
        .append(node.getId())
        .append(' ')
        .append(node.getSourceId())
        .append(" at ")
        .append(mergeSpec.getAttachPath());
    if (!node.getDependsOn().isEmpty()) {
      sb.append(" after ").append(node.getDependsOn());
    }
    if (!node.getBatchSiblings().isEmpty()) {
      sb.append(" batched with ").append(node.getBatchSiblings());
    }
    if (!mergeSpec.getKeyForwarding().isEmpty()) {
      sb.append(" forwarding ").append(mergeSpec.getKeyForwarding());
    }
    if (mergeSpec.getReentryField() != null) {
      sb.append(" via ").append(mergeSpec.getReentryField());
    }
    sb.append(" {\n")
        .append(indent)
        .append(INDENT)
        .append(printSelection(node.getFragment().getSelection()))
        .append('\n')
        .append(indent)
        .append("}\n");
  }

  private static String printField(SelectionNode field) {
    StringBuilder sb = new StringBuilder();
    if (field.getAlias() != null) {
      sb.append(field.getAlias()).append(": ");
    }
    sb.append(field.getFieldName());
    Map<String, Object> arguments = field.getArguments();
    if (!arguments.isEmpty()) {
      sb.append(
          arguments.entrySet().stream()
              .map(argument -> argument.getKey() + ": " + argument.getValue())
              .collect(Collectors.joining(", ", "(", ")")));
    }
    if (field.isComposite()) {
      sb.append(" { ").append(printSelection(field.getChildren())).append(" }");
    }
    return sb.toString();
  }
}
