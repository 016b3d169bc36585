package com.skillflow.shared.model;

import java.util.Map;

/**
 * @param parameters static values or {@code {{inputs.name}}} and {@code {{nodeId.output}}} templates
 * @param position   editor canvas coordinates, carried through untouched
 */
public record WorkflowNode(
    String id,
    NodeKind kind,
    String skillId,
    Map<String, Object> parameters,
    Position position
) {
    public WorkflowNode {
        kind = kind == null ? NodeKind.SKILL : kind;
        parameters = parameters == null ? Map.of() : parameters;
    }

    public static WorkflowNode skill(String id, String skillId, Map<String, Object> parameters) {
        return new WorkflowNode(id, NodeKind.SKILL, skillId, parameters, null);
    }

    public static WorkflowNode control(String id, NodeKind kind) {
        return new WorkflowNode(id, kind, null, Map.of(), null);
    }

    public record Position(double x, double y) {}
}
