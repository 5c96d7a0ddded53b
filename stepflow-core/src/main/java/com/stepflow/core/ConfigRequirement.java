package com.stepflow.core;

import java.util.Objects;

/** A configuration path a step needs, with the type its value must be readable as. */
public record ConfigRequirement(String path, Class<?> type) {
    public ConfigRequirement {
        path = Objects.requireNonNull(path, "path");
        type = Objects.requireNonNull(type, "type");
    }

    /** Null when {@code context} satisfies this requirement, otherwise the lookup failure. */
    ContextException problem(Context context) {
        Object value;
        try {
            value = context.resolve(path);
        } catch (PathNotFoundException e) {
            return e;
        }
        if (!Values.conforms(value, type)) {
            return new ValueTypeException(path, type, value == null ? null : value.getClass());
        }
        return null;
    }
}
