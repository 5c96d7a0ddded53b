package com.stepflow.core;

/** A step's own precondition on its resolved configuration or on its input failed. */
public final class ValidationException extends StepException {
    public ValidationException(String stepName, String message) {
        super(stepName, message, null);
    }

    public ValidationException(String stepName, String message, Throwable cause) {
        super(stepName, message, cause);
    }
}
