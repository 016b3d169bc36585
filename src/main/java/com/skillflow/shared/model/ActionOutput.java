package com.skillflow.shared.model;

import java.util.Map;

/**
 * Result of one action: the primary value typed by the skill's output type,
 * plus action-specific details (exit code, stderr, entry listings).
 */
public record ActionOutput(Object value, Map<String, Object> details) {

    public ActionOutput {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ActionOutput of(Object value) {
        return new ActionOutput(value, Map.of());
    }
}
