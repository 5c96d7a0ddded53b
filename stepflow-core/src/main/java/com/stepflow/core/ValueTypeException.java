package com.stepflow.core;

public final class ValueTypeException extends ContextException {
    private final Class<?> expected;
    private final Class<?> actual;

    public ValueTypeException(String path, Class<?> expected, Class<?> actual) {
        super(path, "Context path '" + path + "' holds " + (actual == null ? "null" : actual.getSimpleName())
            + ", expected " + expected.getSimpleName());
        this.expected = expected;
        this.actual = actual;
    }

    public Class<?> expected() {
        return expected;
    }

    /** Runtime type of the stored value, {@code null} when the stored value is null. */
    public Class<?> actual() {
        return actual;
    }
}
