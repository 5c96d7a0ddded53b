package com.stepflow.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Configuration value that never prints itself. Use {@link #reveal()} at the point the raw value is needed.
 */
public final class Secret {
    private static final String MASK = "**********";

    private final String value;

    private Secret(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Secret of(String value) {
        return new Secret(value);
    }

    public String reveal() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Secret other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return MASK;
    }
}
