package com.skillflow.shared.model;

import java.time.Instant;
import java.util.Map;

public record ExecutionSnapshot(
    String id,
    String skillId,
    String skillName,
    Map<String, Object> parameters,
    ExecutionStatus status,
    ActionOutput result,
    ExecutionError error,
    Instant createdAt,
    Instant decidedAt,
    Instant completedAt
) {}
