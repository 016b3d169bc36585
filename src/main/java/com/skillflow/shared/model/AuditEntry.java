package com.skillflow.shared.model;

import java.time.Instant;
import java.util.Map;

public record AuditEntry(
    String executionId,
    String skillId,
    String skillName,
    Map<String, Object> parameters,
    ExecutionStatus status,
    ActionOutput result,
    ExecutionError error,
    Instant createdAt,
    Instant decidedAt,
    Instant completedAt
) {
    public static AuditEntry from(SkillExecution execution) {
        var s = execution.snapshot();
        if (!s.status().isTerminal()) {
            throw new IllegalStateException("Execution " + s.id() + " is not terminal: " + s.status());
        }
        return new AuditEntry(s.id(), s.skillId(), s.skillName(), s.parameters(), s.status(),
                s.result(), s.error(), s.createdAt(), s.decidedAt(), s.completedAt());
    }

    public ExecutionSnapshot toSnapshot() {
        return new ExecutionSnapshot(executionId, skillId, skillName, parameters, status,
                result, error, createdAt, decidedAt, completedAt);
    }
}
