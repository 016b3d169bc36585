package com.skillflow.shared.model;

public record SkillParameter(
    String name,
    ParameterType type,
    boolean required,
    String description
) {
    public static SkillParameter required(String name, ParameterType type) {
        return new SkillParameter(name, type, true, null);
    }

    public static SkillParameter optional(String name, ParameterType type) {
        return new SkillParameter(name, type, false, null);
    }
}
