package com.skillflow.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

import static com.skillflow.shared.model.SkillException.Kind.SIGNATURE_INVALID;

/**
 * Type of a value flowing out of a skill or along a workflow edge.
 * {@link #ANY} is only compatible as a target, never narrowed implicitly.
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    PATH,
    ANY;

    @JsonCreator
    public static ValueType fromName(String name) {
        if (name == null) return null;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SkillException(SIGNATURE_INVALID, "outputType",
                    "Unknown value type '" + name + "', expected one of string, number, boolean, path, any");
        }
    }

    public boolean acceptsFrom(ValueType source) {
        return this == ANY || this == source;
    }
}
