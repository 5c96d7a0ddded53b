package com.stepflow.config;

import java.io.IOException;
import java.util.Objects;

/** A configuration source could not be read or parsed. */
public final class ContextLoadException extends IOException {
    private final String source;

    public ContextLoadException(String source, String message, Throwable cause) {
        super(Objects.requireNonNull(source, "source") + ": " + message, cause);
        this.source = source;
    }

    public ContextLoadException(String source, String message) {
        this(source, message, null);
    }

    /** Description of the source that failed, e.g. a file path or {@code classpath:name}. */
    public String source() {
        return source;
    }
}
