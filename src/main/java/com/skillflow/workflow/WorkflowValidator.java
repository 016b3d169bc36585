package com.skillflow.workflow;

import com.skillflow.shared.model.NodeKind;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.ValueType;
import com.skillflow.shared.model.Workflow;
import com.skillflow.shared.model.WorkflowEdge;
import com.skillflow.shared.model.WorkflowNode;
import com.skillflow.skills.SkillRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

import static com.skillflow.shared.model.SkillException.Kind.CYCLIC_GRAPH;
import static com.skillflow.shared.model.SkillException.Kind.INVALID_WORKFLOW;
import static com.skillflow.shared.model.SkillException.Kind.TYPE_MISMATCH;

/**
 * Checks structure, acyclicity and edge types of a workflow and computes its
 * run order. Saved workflows are not validated; this runs before execution.
 */
public class WorkflowValidator {

    private final SkillRegistry registry;

    public WorkflowValidator(SkillRegistry registry) {
        this.registry = registry;
    }

    public WorkflowPlan validate(Workflow workflow) {
        var nodes = indexNodes(workflow);
        var conditions = new HashMap<String, EdgeCondition>();
        var incoming = new LinkedHashMap<String, List<WorkflowEdge>>();
        var edgeIds = new HashSet<String>();
        for (var edge : workflow.edges()) {
            if (edge.id() == null || edge.id().isBlank() || !edgeIds.add(edge.id())) {
                throw new SkillException(INVALID_WORKFLOW, edge.id(), "Edge ids must be present and unique");
            }
            if (!nodes.containsKey(edge.sourceNodeId()) || !nodes.containsKey(edge.targetNodeId())) {
                throw new SkillException(INVALID_WORKFLOW, edge.id(),
                        "Edge " + edge.id() + " references a missing node");
            }
            if (edge.condition() != null && !edge.condition().isBlank()) {
                try {
                    conditions.put(edge.id(), EdgeCondition.parse(edge.condition()));
                } catch (IllegalArgumentException e) {
                    throw new SkillException(INVALID_WORKFLOW, edge.id(), e.getMessage());
                }
            }
            incoming.computeIfAbsent(edge.targetNodeId(), k -> new ArrayList<>()).add(edge);
        }

        var order = topologicalOrder(workflow);
        for (var edge : workflow.edges()) {
            checkTypes(edge, nodes.get(edge.sourceNodeId()), nodes.get(edge.targetNodeId()));
        }
        return new WorkflowPlan(workflow, order, incoming, conditions);
    }

    private Map<String, WorkflowNode> indexNodes(Workflow workflow) {
        var nodes = new LinkedHashMap<String, WorkflowNode>();
        for (var node : workflow.nodes()) {
            if (node.id() == null || node.id().isBlank()) {
                throw new SkillException(INVALID_WORKFLOW, "nodes", "Node id is required");
            }
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new SkillException(INVALID_WORKFLOW, node.id(), "Duplicate node id: " + node.id());
            }
            if (node.kind() == NodeKind.SKILL) {
                if (node.skillId() == null || node.skillId().isBlank()) {
                    throw new SkillException(INVALID_WORKFLOW, node.id(), "Node " + node.id() + " has no skill");
                }
                registry.lookup(node.skillId());
            }
        }
        return nodes;
    }

    /** Kahn's algorithm; among ready nodes the one declared first runs first. */
    static List<WorkflowNode> topologicalOrder(Workflow workflow) {
        var position = new HashMap<String, Integer>();
        for (int i = 0; i < workflow.nodes().size(); i++) {
            position.put(workflow.nodes().get(i).id(), i);
        }
        var inDegree = new int[workflow.nodes().size()];
        var successors = new HashMap<Integer, List<Integer>>();
        for (var edge : workflow.edges()) {
            int from = position.get(edge.sourceNodeId());
            int to = position.get(edge.targetNodeId());
            successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            inDegree[to]++;
        }

        var ready = new PriorityQueue<Integer>();
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }
        var order = new ArrayList<WorkflowNode>();
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order.add(workflow.nodes().get(next));
            for (int succ : successors.getOrDefault(next, List.of())) {
                if (--inDegree[succ] == 0) ready.add(succ);
            }
        }
        if (order.size() < workflow.nodes().size()) {
            var stuck = workflow.nodes().stream()
                    .filter(n -> !order.contains(n))
                    .map(WorkflowNode::id)
                    .collect(Collectors.joining(", "));
            throw new SkillException(CYCLIC_GRAPH, stuck, "Workflow contains a cycle through: " + stuck);
        }
        return order;
    }

    private void checkTypes(WorkflowEdge edge, WorkflowNode source, WorkflowNode target) {
        var sourceType = outputType(source);
        var targetType = inputType(edge, target);
        if (!targetType.acceptsFrom(sourceType)) {
            throw new SkillException(TYPE_MISMATCH, edge.id(), "Edge " + edge.id() + " carries "
                    + sourceType + " from " + source.id() + " but " + target.id() + " expects " + targetType);
        }
    }

    private ValueType outputType(WorkflowNode node) {
        if (node.kind() != NodeKind.SKILL) return ValueType.ANY;
        return registry.lookup(node.skillId()).outputType();
    }

    private ValueType inputType(WorkflowEdge edge, WorkflowNode target) {
        if (edge.targetParameter() == null || edge.targetParameter().isBlank()) return ValueType.ANY;
        if (target.kind() != NodeKind.SKILL) {
            throw new SkillException(TYPE_MISMATCH, edge.id(),
                    "Edge " + edge.id() + " binds a parameter on control node " + target.id());
        }
        var definition = registry.lookup(target.skillId());
        return definition.parameter(edge.targetParameter())
                .map(p -> p.type().valueType())
                .orElseThrow(() -> new SkillException(TYPE_MISMATCH, edge.id(), "Skill '" + definition.id()
                        + "' has no parameter '" + edge.targetParameter() + "'"));
    }
}
