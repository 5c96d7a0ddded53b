package com.stepflow.core;

/** Base for lookups against a {@link Context} that cannot be satisfied. */
public abstract class ContextException extends RuntimeException {
    private final String path;

    protected ContextException(String path, String message) {
        super(message);
        this.path = path;
    }

    /** The dotted path that was requested. */
    public String path() {
        return path;
    }
}
