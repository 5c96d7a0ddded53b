package com.stepflow.core;

import java.util.List;
import java.util.Objects;

/**
 * A run was aborted by its {@link CancellationToken} between two children. Kept distinct from domain failures so
 * callers can tell a cancelled run from a broken one. When a nested task was cancelled, the cause is the inner
 * cancellation.
 */
public final class TaskCancelledException extends StepException {
    private final int position;
    private final String nextStep;
    private final List<String> completed;
    private final List<StepTrace> trace;

    public TaskCancelledException(String taskName, int position, String nextStep, List<String> completed,
                                  List<StepTrace> trace, TaskCancelledException cause) {
        super(taskName, "cancelled before step '" + nextStep + "' at position " + position
            + ", completed " + completed, cause);
        this.position = position;
        this.nextStep = Objects.requireNonNull(nextStep, "nextStep");
        this.completed = List.copyOf(completed);
        this.trace = List.copyOf(trace);
    }

    public String taskName() {
        return stepName();
    }

    /** 1-based position of the child that was not started (or, for a nested cancellation, was interrupted). */
    public int position() {
        return position;
    }

    public String nextStep() {
        return nextStep;
    }

    public List<String> completed() {
        return completed;
    }

    public List<StepTrace> trace() {
        return trace;
    }
}
