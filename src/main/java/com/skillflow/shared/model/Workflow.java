package com.skillflow.shared.model;

import java.time.Instant;
import java.util.List;

public record Workflow(
    String id,
    String name,
    List<WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    Instant createdAt,
    Instant updatedAt
) {
    public Workflow {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public Workflow(String id, String name, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        this(id, name, nodes, edges, null, null);
    }

    public Workflow withId(String newId, Instant created, Instant updated) {
        return new Workflow(newId, name, nodes, edges, created, updated);
    }
}
