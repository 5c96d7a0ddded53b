package com.stepflow.core;

/** Domain logic failed while a step was executing. The cause, when present, is the original fault. */
public final class StepExecutionException extends StepException {
    public StepExecutionException(String stepName, String message, Throwable cause) {
        super(stepName, message, cause);
    }
}
