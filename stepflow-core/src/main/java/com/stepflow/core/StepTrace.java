package com.stepflow.core;

import java.util.Objects;

/** Record of one child invocation inside a task run. {@code output} is null unless the child succeeded. */
public record StepTrace(
    int position,
    String name,
    StepState state,
    Output output,
    long elapsedNanos,
    StepException error
) {
    public StepTrace {
        name = Objects.requireNonNull(name, "name");
        state = Objects.requireNonNull(state, "state");
        if (position < 1) throw new IllegalArgumentException("position is 1-based");
    }

    public boolean succeeded() {
        return state == StepState.SUCCEEDED;
    }
}
