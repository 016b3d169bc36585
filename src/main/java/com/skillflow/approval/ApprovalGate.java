package com.skillflow.approval;

import com.skillflow.shared.model.ExecutionSnapshot;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.SkillExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.skillflow.shared.model.SkillException.Kind.ALREADY_DECIDED;
import static com.skillflow.shared.model.SkillException.Kind.EXECUTION_NOT_FOUND;

/**
 * Holds sensitive executions until an operator decides on them. Each pending
 * execution owns its own future; deciding one never touches another.
 */
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private static final class Pending {
        final SkillExecution execution;
        final CompletableFuture<ApprovalDecision> decision = new CompletableFuture<>();
        volatile ScheduledFuture<?> expiry;

        Pending(SkillExecution execution) {
            this.execution = execution;
        }
    }

    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final Map<String, ApprovalDecision> decided = new ConcurrentHashMap<>();
    private final List<ApprovalNotifier> notifiers = new CopyOnWriteArrayList<>();
    private final long timeoutSeconds;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor timer;

    public ApprovalGate() {
        this(0, Clock.systemUTC());
    }

    public ApprovalGate(long timeoutSeconds, Clock clock) {
        this.timeoutSeconds = timeoutSeconds;
        this.clock = clock;
        this.timer = timeoutSeconds > 0 ? newTimer() : null;
    }

    private static ScheduledThreadPoolExecutor newTimer() {
        var timer = new ScheduledThreadPoolExecutor(1, r -> {
            var t = new Thread(r, "skillflow-approval-timer");
            t.setDaemon(true);
            return t;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    public void addNotifier(ApprovalNotifier notifier) {
        notifiers.add(notifier);
    }

    public CompletableFuture<ApprovalDecision> open(SkillExecution execution) {
        var entry = new Pending(execution);
        pending.put(execution.id(), entry);
        log.info("Execution {} of '{}' awaiting approval", execution.id(), execution.skillId());
        if (timer != null) {
            entry.expiry = timer.schedule(() -> resolve(execution.id(), ApprovalDecision.EXPIRED),
                    timeoutSeconds, TimeUnit.SECONDS);
        }
        var snapshot = execution.snapshot();
        for (var notifier : notifiers) {
            try {
                notifier.approvalRequested(snapshot, this);
            } catch (RuntimeException e) {
                log.warn("Approval notifier failed for execution {}: {}", execution.id(), e.getMessage());
            }
        }
        return entry.decision;
    }

    public void approve(String executionId) {
        decide(executionId, ApprovalDecision.APPROVED);
    }

    public void deny(String executionId) {
        decide(executionId, ApprovalDecision.DENIED);
    }

    public boolean isPending(String executionId) {
        return pending.containsKey(executionId);
    }

    public List<ExecutionSnapshot> pending() {
        return pending.values().stream()
                .map(p -> p.execution.snapshot())
                .sorted((a, b) -> a.createdAt().compareTo(b.createdAt()))
                .toList();
    }

    /** Drops the record of a decision once its execution has been audited. */
    public void forget(String executionId) {
        decided.remove(executionId);
    }

    int scheduledTimeouts() {
        return timer == null ? 0 : timer.getQueue().size();
    }

    /** Withdraws every pending approval; nothing pending survives a restart. */
    public void shutdown() {
        for (var id : List.copyOf(pending.keySet())) {
            resolve(id, ApprovalDecision.WITHDRAWN);
        }
        if (timer != null) timer.shutdownNow();
    }

    private void decide(String executionId, ApprovalDecision decision) {
        if (!resolve(executionId, decision)) {
            if (decided.containsKey(executionId)) {
                throw new SkillException(ALREADY_DECIDED, executionId,
                        "Execution " + executionId + " was already " + decided.get(executionId));
            }
            throw new SkillException(EXECUTION_NOT_FOUND, executionId,
                    "No pending execution " + executionId);
        }
    }

    private boolean resolve(String executionId, ApprovalDecision decision) {
        if (!pending.containsKey(executionId)) return false;
        // first decision wins; later callers see ALREADY_DECIDED
        if (decided.putIfAbsent(executionId, decision) != null) return false;
        var entry = pending.remove(executionId);
        var expiry = entry.expiry;
        if (expiry != null && decision != ApprovalDecision.EXPIRED) expiry.cancel(false);
        var now = clock.instant();
        switch (decision) {
            case APPROVED -> entry.execution.markApproved(now);
            case DENIED -> entry.execution.markDenied(now);
            default -> { }
        }
        log.info("Execution {} {}", executionId, decision);
        entry.decision.complete(decision);
        return true;
    }
}
