package com.skillflow.workflow;

import com.skillflow.shared.model.Workflow;
import com.skillflow.shared.model.WorkflowEdge;
import com.skillflow.shared.model.WorkflowNode;

import java.util.List;
import java.util.Map;

/**
 * A workflow that passed validation, with its run order fixed.
 *
 * @param order      topological order, ties broken by node insertion order
 * @param incoming   incoming edges per node id, in edge declaration order
 * @param conditions parsed condition per edge id, for edges that carry one
 */
public record WorkflowPlan(
    Workflow workflow,
    List<WorkflowNode> order,
    Map<String, List<WorkflowEdge>> incoming,
    Map<String, EdgeCondition> conditions
) {
    public List<String> orderedIds() {
        return order.stream().map(WorkflowNode::id).toList();
    }

    public List<WorkflowEdge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }
}
