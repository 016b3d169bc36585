package com.skillflow.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

import static com.skillflow.shared.model.SkillException.Kind.SIGNATURE_INVALID;

public enum ParameterType {
    STRING,
    NUMBER,
    BOOLEAN,
    PATH;

    /** Case-insensitive lookup; unknown names fail {@code SIGNATURE_INVALID}. */
    @JsonCreator
    public static ParameterType fromName(String name) {
        if (name == null) return null;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SkillException(SIGNATURE_INVALID, "type",
                    "Unknown parameter type '" + name + "', expected one of string, number, boolean, path");
        }
    }

    public ValueType valueType() {
        return switch (this) {
            case STRING -> ValueType.STRING;
            case NUMBER -> ValueType.NUMBER;
            case BOOLEAN -> ValueType.BOOLEAN;
            case PATH -> ValueType.PATH;
        };
    }

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case PATH -> value instanceof String s && !s.isBlank() && !s.contains("\0");
        };
    }
}
