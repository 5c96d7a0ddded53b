package com.stepflow.core;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Step#run}: either an output or the error that stopped the run, plus the trace of whatever
 * executed. Exactly one of {@code output} and {@code error} is non-null.
 */
public record StepResult(
    String stepName,
    Output output,
    StepException error,
    List<StepTrace> trace,
    long totalNanos
) {
    public StepResult {
        stepName = Objects.requireNonNull(stepName, "stepName");
        trace = List.copyOf(Objects.requireNonNull(trace, "trace"));
        if ((output == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of output and error must be set");
        }
    }

    public boolean succeeded() {
        return error == null;
    }

    public Output orElseThrow() throws StepException {
        if (error != null) throw error;
        return output;
    }
}
