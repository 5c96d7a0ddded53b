package com.stepflow.core;

import java.util.Objects;

/**
 * Tracks one invocation of a step through {@code CONSTRUCTED -> VALIDATED -> EXECUTING -> SUCCEEDED | FAILED}.
 * Steps themselves stay stateless, so one instance can serve many runs; the state lives here.
 */
public final class StepRun {
    private final Step step;
    private final int position;
    private StepState state = StepState.CONSTRUCTED;
    private long startNanos;
    private boolean started;
    private long elapsedNanos;
    private Output output;
    private StepException error;

    public StepRun(Step step, int position) {
        this.step = Objects.requireNonNull(step, "step");
        this.position = position;
    }

    public StepState state() {
        return state;
    }

    public void validate(Context context) throws ConfigResolutionException, ValidationException {
        moveTo(StepState.VALIDATED, StepState.CONSTRUCTED);
        startNanos = System.nanoTime();
        started = true;
        try {
            step.validate(context);
        } catch (ConfigResolutionException | ValidationException e) {
            fail(e);
            throw e;
        } catch (ContextException e) {
            ConfigResolutionException wrapped = new ConfigResolutionException(step.name(), e);
            fail(wrapped);
            throw wrapped;
        } catch (RuntimeException e) {
            ValidationException wrapped = new ValidationException(step.name(), "validation failed: " + e, e);
            fail(wrapped);
            throw wrapped;
        }
        state = StepState.VALIDATED;
    }

    public Output execute(Context context, Output input) throws StepException {
        moveTo(StepState.EXECUTING, StepState.VALIDATED);
        state = StepState.EXECUTING;
        Output result;
        try {
            result = step.execute(context, input);
            if (result == null) {
                throw new StepExecutionException(step.name(), "execute returned no output", null);
            }
            step.declareRequirements().output().verify(step.name(), result);
        } catch (StepException e) {
            fail(e);
            throw e;
        } catch (RuntimeException e) {
            StepExecutionException wrapped = new StepExecutionException(step.name(), "execution failed: " + e, e);
            fail(wrapped);
            throw wrapped;
        }
        output = result;
        elapsedNanos = System.nanoTime() - startNanos;
        state = StepState.SUCCEEDED;
        return result;
    }

    /** Marks the run failed for a reason found outside the step, e.g. while preparing its input. */
    public void fail(StepException failure) {
        if (!state.canMoveTo(StepState.FAILED)) {
            throw new IllegalStateException("step '" + step.name() + "' cannot fail from " + state);
        }
        error = Objects.requireNonNull(failure, "failure");
        elapsedNanos = started ? System.nanoTime() - startNanos : 0L;
        state = StepState.FAILED;
    }

    public StepTrace trace() {
        return new StepTrace(position, step.name(), state, output, elapsedNanos, error);
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    private void moveTo(StepState next, StepState required) {
        if (state != required || !state.canMoveTo(next)) {
            throw new IllegalStateException("step '" + step.name() + "' cannot move from " + state + " to " + next);
        }
    }
}
