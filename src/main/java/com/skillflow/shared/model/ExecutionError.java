package com.skillflow.shared.model;

public record ExecutionError(SkillException.Kind kind, String message) {

    public static ExecutionError from(SkillException e) {
        return new ExecutionError(e.getKind(), e.getReason());
    }
}
