package com.skillflow.workflow;

import com.skillflow.observability.EngineMetrics;
import com.skillflow.pipeline.ExecutionPipeline;
import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.ExecutionError;
import com.skillflow.shared.model.ExecutionStatus;
import com.skillflow.shared.model.NodeKind;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.Workflow;
import com.skillflow.shared.model.WorkflowEdge;
import com.skillflow.shared.model.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import static com.skillflow.shared.model.SkillException.Kind.APPROVAL_DENIED;
import static com.skillflow.shared.model.SkillException.Kind.WORKFLOW_NODE_FAILED;

/**
 * Runs a validated workflow one node at a time in topological order. Each
 * node's pipeline call, approval wait included, finishes before the next
 * node starts. The first failed node halts the run; nodes that already ran
 * keep their effects.
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final WorkflowRepository repository;
    private final WorkflowValidator validator;
    private final NodeParameterResolver resolver;
    private final ExecutionPipeline pipeline;
    private final EngineMetrics metrics;
    private final ExecutorService runner;

    public WorkflowEngine(WorkflowRepository repository, WorkflowValidator validator, ExecutionPipeline pipeline,
                          EngineMetrics metrics, ExecutorService runner) {
        this.repository = repository;
        this.validator = validator;
        this.resolver = new NodeParameterResolver();
        this.pipeline = pipeline;
        this.metrics = metrics;
        this.runner = runner;
    }

    public WorkflowPlan validate(Workflow workflow) {
        return validator.validate(workflow);
    }

    /**
     * Validation failures ({@code WORKFLOW_NOT_FOUND}, {@code CYCLIC_GRAPH},
     * {@code TYPE_MISMATCH}, ...) are thrown here; node failures are reported
     * in the returned result.
     */
    public CompletableFuture<WorkflowResult> execute(String workflowId, Map<String, Object> inputs) {
        var plan = validator.validate(repository.get(workflowId));
        var given = inputs == null ? Map.<String, Object>of() : inputs;
        return CompletableFuture.supplyAsync(() -> run(plan, given), runner);
    }

    public void shutdown() {
        runner.shutdownNow();
    }

    WorkflowResult run(WorkflowPlan plan, Map<String, Object> inputs) {
        var workflowId = plan.workflow().id();
        log.info("Running workflow '{}' in order {}", workflowId, plan.orderedIds());
        var executed = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        var ran = new HashSet<String>();
        var outputs = new LinkedHashMap<String, ActionOutput>();
        var executionIds = new LinkedHashMap<String, String>();

        for (var node : plan.order()) {
            var incoming = plan.incoming(node.id());
            if (!isActive(incoming, ran, outputs, plan)) {
                log.info("Workflow '{}' skipping node {}", workflowId, node.id());
                skipped.add(node.id());
                continue;
            }
            executed.add(node.id());
            if (node.kind() != NodeKind.SKILL) {
                outputs.put(node.id(), ActionOutput.of(null));
                ran.add(node.id());
                continue;
            }

            ExecutionError failure;
            try {
                var parameters = resolver.resolve(node, incoming, inputs, outputs);
                var handle = pipeline.submit(node.skillId(), parameters);
                executionIds.put(node.id(), handle.executionId());
                var done = handle.await().snapshot();
                if (done.status() == ExecutionStatus.COMPLETED) {
                    outputs.put(node.id(), done.result());
                    ran.add(node.id());
                    continue;
                }
                failure = done.error();
            } catch (SkillException e) {
                failure = ExecutionError.from(e);
            } catch (IllegalStateException e) {
                // pipeline closed under the run
                failure = new ExecutionError(APPROVAL_DENIED, "Engine shut down: " + e.getMessage());
            }

            log.warn("Workflow '{}' halted at node {}: {} {}", workflowId, node.id(),
                    failure.kind(), failure.message());
            metrics.workflowRuns("failed").increment();
            var error = new ExecutionError(WORKFLOW_NODE_FAILED,
                    "Node " + node.id() + " failed: [" + failure.kind() + "] " + failure.message());
            return result(workflowId, false, executed, skipped, node.id(), error, failure, outputs, executionIds);
        }

        log.info("Workflow '{}' completed: ran {}, skipped {}", workflowId, executed, skipped);
        metrics.workflowRuns("success").increment();
        return result(workflowId, true, executed, skipped, null, null, null, outputs, executionIds);
    }

    /** A node runs when every incoming edge comes from a node that ran and its condition holds. */
    private static boolean isActive(List<WorkflowEdge> incoming, Set<String> ran,
                                    Map<String, ActionOutput> outputs, WorkflowPlan plan) {
        for (var edge : incoming) {
            if (!ran.contains(edge.sourceNodeId())) return false;
            var condition = plan.conditions().get(edge.id());
            if (condition != null && !condition.test(outputs.get(edge.sourceNodeId()))) return false;
        }
        return true;
    }

    private static WorkflowResult result(String workflowId, boolean success, List<String> executed,
                                         List<String> skipped, String failedNode, ExecutionError error,
                                         ExecutionError nodeError, Map<String, ActionOutput> outputs,
                                         Map<String, String> executionIds) {
        return new WorkflowResult(workflowId, success, List.copyOf(executed), List.copyOf(skipped),
                failedNode, error, nodeError,
                Collections.unmodifiableMap(new LinkedHashMap<>(outputs)),
                Collections.unmodifiableMap(new LinkedHashMap<>(executionIds)));
    }
}
