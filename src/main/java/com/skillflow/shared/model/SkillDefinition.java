package com.skillflow.shared.model;

import java.util.List;
import java.util.Optional;

/**
 * Signature and metadata of a skill an agent may invoke.
 *
 * @param sensitive       explicit approval flag; {@code null} when the registrant left it unset
 * @param outputType      type of {@link ActionOutput#value()} produced by the skill
 * @param commandTemplate shell command with {@code {{param}}} placeholders, for user-defined skills
 */
public record SkillDefinition(
    String id,
    String name,
    String description,
    String category,
    List<SkillParameter> parameters,
    Boolean sensitive,
    ValueType outputType,
    String commandTemplate
) {
    public SkillDefinition {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        outputType = outputType == null ? ValueType.ANY : outputType;
    }

    public Optional<SkillParameter> parameter(String parameterName) {
        return parameters.stream()
                .filter(p -> p.name() != null && p.name().equals(parameterName))
                .findFirst();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
