package com.skillflow.pipeline;

import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillException;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.skillflow.shared.model.SkillException.Kind.PARAMETER_INVALID;

public final class ParameterValidator {

    private ParameterValidator() {}

    /**
     * Checks required parameters, value types and undeclared names.
     *
     * @return the parameters in declaration order, nulls dropped
     */
    public static Map<String, Object> validate(SkillDefinition definition, Map<String, Object> parameters) {
        var given = parameters == null ? Map.<String, Object>of() : parameters;
        for (var name : given.keySet()) {
            if (definition.parameter(name).isEmpty()) {
                throw new SkillException(PARAMETER_INVALID, name,
                        "Unknown parameter '" + name + "' for skill '" + definition.id() + "'");
            }
        }
        var validated = new LinkedHashMap<String, Object>();
        for (var p : definition.parameters()) {
            var value = given.get(p.name());
            if (value == null) {
                if (p.required()) {
                    throw new SkillException(PARAMETER_INVALID, p.name(),
                            "Missing required parameter '" + p.name() + "' for skill '" + definition.id() + "'");
                }
                continue;
            }
            if (!p.type().accepts(value)) {
                throw new SkillException(PARAMETER_INVALID, p.name(),
                        "Parameter '" + p.name() + "' expects " + p.type() + " but got "
                                + value.getClass().getSimpleName());
            }
            validated.put(p.name(), value);
        }
        return validated;
    }
}
