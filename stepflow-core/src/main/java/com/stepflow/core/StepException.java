package com.stepflow.core;

import java.util.Objects;

/**
 * Base of every failure a step or task reports. The subtype tells configuration problems (before any side
 * effect), precondition failures, domain failures, composition wrapping and cancellation apart.
 */
public abstract class StepException extends Exception {
    private final String stepName;

    protected StepException(String stepName, String message, Throwable cause) {
        super("[" + Objects.requireNonNull(stepName, "stepName") + "] " + message, cause);
        this.stepName = stepName;
    }

    /** Name of the step (or task) that raised this failure. */
    public String stepName() {
        return stepName;
    }
}
