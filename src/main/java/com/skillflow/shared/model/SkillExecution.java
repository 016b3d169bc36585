package com.skillflow.shared.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One invocation attempt of a skill.
 *
 * <pre>
 * PENDING -> APPROVED -> COMPLETED | FAILED
 * PENDING -> DENIED   -> FAILED
 * PENDING -> FAILED   (approval expired or withdrawn)
 * </pre>
 *
 * Only the pipeline and the approval gate call the transition methods.
 */
public class SkillExecution {

    private final String id;
    private final String skillId;
    private final String skillName;
    private final Map<String, Object> parameters;
    private final Instant createdAt;

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private ActionOutput result;
    private ExecutionError error;
    private Instant decidedAt;
    private Instant completedAt;

    public SkillExecution(String id, SkillDefinition definition, Map<String, Object> parameters, Instant createdAt) {
        this.id = id;
        this.skillId = definition.id();
        this.skillName = definition.displayName();
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public String skillId() { return skillId; }
    public Map<String, Object> parameters() { return parameters; }

    public synchronized ExecutionStatus status() { return status; }

    public synchronized void markApproved(Instant at) {
        require(ExecutionStatus.PENDING, ExecutionStatus.APPROVED);
        status = ExecutionStatus.APPROVED;
        decidedAt = at;
    }

    public synchronized void markDenied(Instant at) {
        require(ExecutionStatus.PENDING, ExecutionStatus.DENIED);
        status = ExecutionStatus.DENIED;
        decidedAt = at;
    }

    public synchronized void complete(ActionOutput output, Instant at) {
        require(ExecutionStatus.APPROVED, ExecutionStatus.COMPLETED);
        status = ExecutionStatus.COMPLETED;
        result = output;
        completedAt = at;
    }

    public synchronized void fail(ExecutionError failure, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " already " + status);
        }
        if (decidedAt == null) decidedAt = at;
        status = ExecutionStatus.FAILED;
        error = failure;
        completedAt = at;
    }

    public synchronized ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(id, skillId, skillName, parameters, status,
                result, error, createdAt, decidedAt, completedAt);
    }

    private void require(ExecutionStatus expected, ExecutionStatus next) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Execution " + id + " cannot move from " + status + " to " + next);
        }
    }
}
