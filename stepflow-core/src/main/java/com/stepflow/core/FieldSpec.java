package com.stepflow.core;

import java.util.Objects;

public record FieldSpec(String name, Class<?> type, boolean required, String description) {
    public FieldSpec {
        name = Objects.requireNonNull(name, "name");
        type = Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        if (name.isBlank()) throw new IllegalArgumentException("field name must not be blank");
    }

    public static FieldSpec required(String name, Class<?> type) {
        return new FieldSpec(name, type, true, "");
    }

    public static FieldSpec optional(String name, Class<?> type) {
        return new FieldSpec(name, type, false, "");
    }

    public FieldSpec describedAs(String text) {
        return new FieldSpec(name, type, required, text);
    }

    /** Null when the value conforms, otherwise a short description of the problem. */
    String violation(boolean present, Object value) {
        if (!present || value == null) {
            return required ? "required field '" + name + "' is missing" : null;
        }
        if (!type.isInstance(value)) {
            return "field '" + name + "' is " + value.getClass().getSimpleName() + ", expected " + type.getSimpleName();
        }
        return null;
    }
}
