package com.skillflow.shared.model;

/**
 * @param targetParameter parameter of the target skill fed with the source output; null for ordering-only edges
 * @param condition       predicate over the source result gating the target; null means always
 */
public record WorkflowEdge(
    String id,
    String sourceNodeId,
    String targetNodeId,
    String targetParameter,
    String condition
) {
    public static WorkflowEdge of(String id, String source, String target) {
        return new WorkflowEdge(id, source, target, null, null);
    }

    public static WorkflowEdge binding(String id, String source, String target, String targetParameter) {
        return new WorkflowEdge(id, source, target, targetParameter, null);
    }

    public static WorkflowEdge when(String id, String source, String target, String condition) {
        return new WorkflowEdge(id, source, target, null, condition);
    }
}
