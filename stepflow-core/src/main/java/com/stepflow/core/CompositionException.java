package com.stepflow.core;

import java.util.List;
import java.util.Objects;

/**
 * A task's wrapping of a failing child. Carries the child's name, its 1-based position, the children that had
 * already completed and the trace up to and including the failure. When the child is itself a task the cause is
 * another {@code CompositionException}; {@link #failure()} walks the chain to the leaf that failed first.
 */
public final class CompositionException extends StepException {
    private final int position;
    private final String childName;
    private final List<String> completed;
    private final List<StepTrace> trace;

    public CompositionException(String taskName, int position, String childName, List<String> completed,
                                List<StepTrace> trace, StepException cause) {
        super(taskName, "step '" + childName + "' at position " + position + " failed after " + completed
            + ": " + Objects.requireNonNull(cause, "cause").getMessage(), cause);
        this.position = position;
        this.childName = Objects.requireNonNull(childName, "childName");
        this.completed = List.copyOf(completed);
        this.trace = List.copyOf(trace);
    }

    public String taskName() {
        return stepName();
    }

    /** 1-based position of the failing child in its task. */
    public int position() {
        return position;
    }

    public String childName() {
        return childName;
    }

    /** Names of the children that completed before the failure, in execution order. */
    public List<String> completed() {
        return completed;
    }

    public List<StepTrace> trace() {
        return trace;
    }

    @Override
    public synchronized StepException getCause() {
        return (StepException) super.getCause();
    }

    /** The innermost non-composition failure, i.e. what the originating leaf step reported. */
    public StepException failure() {
        StepException current = getCause();
        while (current instanceof CompositionException composition) {
            current = composition.getCause();
        }
        return current;
    }

    /** Name of the leaf step where the failure originated. */
    public String originatingStep() {
        return failure().stepName();
    }

    /** The deepest throwable in the cause chain, e.g. the exception domain code threw. */
    public Throwable rootCause() {
        Throwable current = this;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
