package com.skillflow.pipeline;

import com.skillflow.actions.ActionExecutor;
import com.skillflow.approval.ApprovalDecision;
import com.skillflow.approval.ApprovalGate;
import com.skillflow.audit.AuditLog;
import com.skillflow.observability.EngineMetrics;
import com.skillflow.shared.model.AuditEntry;
import com.skillflow.shared.model.ExecutionError;
import com.skillflow.shared.model.ExecutionSnapshot;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.SkillExecution;
import com.skillflow.skills.SensitivityClassifier;
import com.skillflow.skills.SkillRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.skillflow.shared.model.SkillException.Kind.ALREADY_DECIDED;
import static com.skillflow.shared.model.SkillException.Kind.APPROVAL_DENIED;
import static com.skillflow.shared.model.SkillException.Kind.APPROVAL_TIMED_OUT;
import static com.skillflow.shared.model.SkillException.Kind.EXECUTION_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.IO_ERROR;

/**
 * Runs one skill call: resolve, validate, classify, wait for approval when
 * sensitive, dispatch, record. Nothing touches the action executor before
 * the execution is approved, and every minted execution ends with exactly
 * one audit entry.
 */
public class ExecutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPipeline.class);

    private final SkillRegistry registry;
    private final ApprovalGate gate;
    private final ActionExecutor actionExecutor;
    private final AuditLog auditLog;
    private final EngineMetrics metrics;
    private final ExecutorService workers;
    private final Executor dispatch;
    private final Clock clock;
    private final Map<String, SkillExecution> inFlight = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ExecutionPipeline(SkillRegistry registry, ApprovalGate gate, ActionExecutor actionExecutor,
                             AuditLog auditLog, EngineMetrics metrics, ExecutorService workers, Clock clock) {
        this.registry = registry;
        this.gate = gate;
        this.actionExecutor = actionExecutor;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.workers = workers;
        this.clock = clock;
        // a decision arriving while the pool drains still has to settle its execution
        this.dispatch = task -> {
            try {
                workers.execute(task);
            } catch (RejectedExecutionException e) {
                task.run();
            }
        };
    }

    /**
     * @throws SkillException {@code SKILL_NOT_FOUND} or {@code PARAMETER_INVALID}, before any id is minted
     */
    public ExecutionHandle submit(String skillId, Map<String, Object> parameters) {
        if (closed) {
            throw new IllegalStateException("Execution pipeline is shut down");
        }
        var definition = registry.lookup(skillId);
        var validated = ParameterValidator.validate(definition, parameters);
        var execution = new SkillExecution(UUID.randomUUID().toString(), definition, validated, clock.instant());
        inFlight.put(execution.id(), execution);

        var gated = SensitivityClassifier.requiresApproval(definition);
        CompletableFuture<ApprovalDecision> decision;
        if (gated) {
            decision = gate.open(execution);
        } else {
            execution.markApproved(clock.instant());
            decision = CompletableFuture.completedFuture(ApprovalDecision.APPROVED);
        }
        log.info("Execution {} submitted for '{}' (approval {})", execution.id(), skillId,
                gated ? "required" : "not required");

        var completion = decision
                .thenApplyAsync(d -> run(definition, execution, d, gated), dispatch)
                .exceptionally(t -> abort(execution, t))
                .thenApply(this::finish);
        return new ExecutionHandle(execution.id(), completion);
    }

    public void approve(String executionId) {
        decide(executionId, true);
    }

    public void deny(String executionId) {
        decide(executionId, false);
    }

    public Optional<ExecutionSnapshot> find(String executionId) {
        var live = inFlight.get(executionId);
        if (live != null) return Optional.of(live.snapshot());
        return auditLog.find(executionId).map(AuditEntry::toSnapshot);
    }

    public void shutdown() {
        closed = true;
        gate.shutdown();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after shutdown; {} executions in flight", inFlight.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void decide(String executionId, boolean approve) {
        try {
            if (approve) gate.approve(executionId);
            else gate.deny(executionId);
            return;
        } catch (SkillException e) {
            if (e.getKind() != EXECUTION_NOT_FOUND) throw e;
        }
        // auto-approved, or decided and already audited
        if (find(executionId).isPresent()) {
            throw new SkillException(ALREADY_DECIDED, executionId,
                    "Execution " + executionId + " is no longer awaiting approval");
        }
        throw new SkillException(EXECUTION_NOT_FOUND, executionId, "No execution " + executionId);
    }

    private SkillExecution run(SkillDefinition definition, SkillExecution execution,
                               ApprovalDecision decision, boolean gated) {
        if (gated) {
            metrics.approvalDecisions(decision.name().toLowerCase()).increment();
        }
        switch (decision) {
            case DENIED -> {
                execution.fail(new ExecutionError(APPROVAL_DENIED, "Denied by operator"), clock.instant());
                return execution;
            }
            case EXPIRED -> {
                execution.fail(new ExecutionError(APPROVAL_TIMED_OUT, "No approval decision in time"), clock.instant());
                return execution;
            }
            case WITHDRAWN -> {
                execution.fail(new ExecutionError(APPROVAL_DENIED,
                        "Engine shut down before a decision was made"), clock.instant());
                return execution;
            }
            case APPROVED -> { }
        }

        var started = System.nanoTime();
        try {
            var output = actionExecutor.execute(execution.id(), definition, execution.parameters());
            execution.complete(output, clock.instant());
        } catch (SkillException e) {
            log.warn("Execution {} of '{}' failed: {}", execution.id(), definition.id(), e.getMessage());
            execution.fail(ExecutionError.from(e), clock.instant());
        } catch (RuntimeException e) {
            log.error("Execution {} of '{}' failed unexpectedly", execution.id(), definition.id(), e);
            execution.fail(new ExecutionError(IO_ERROR, String.valueOf(e.getMessage())), clock.instant());
        }
        metrics.skillDuration(definition.id()).record(Duration.ofNanos(System.nanoTime() - started));
        return execution;
    }

    private SkillExecution abort(SkillExecution execution, Throwable t) {
        log.error("Execution {} aborted", execution.id(), t);
        if (!execution.status().isTerminal()) {
            execution.fail(new ExecutionError(IO_ERROR, String.valueOf(t.getMessage())), clock.instant());
        }
        return execution;
    }

    private SkillExecution finish(SkillExecution execution) {
        try {
            var entry = AuditEntry.from(execution);
            auditLog.append(entry);
            metrics.skillExecutions(entry.skillId(), entry.status().name().toLowerCase()).increment();
            if (entry.error() != null) {
                log.info("Execution {} of '{}' {} ({})", entry.executionId(), entry.skillId(),
                        entry.status(), entry.error().kind());
            } else {
                log.info("Execution {} of '{}' {}", entry.executionId(), entry.skillId(), entry.status());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record execution {}", execution.id(), e);
        } finally {
            gate.forget(execution.id());
            inFlight.remove(execution.id());
        }
        return execution;
    }
}
