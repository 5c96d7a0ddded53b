package com.stepflow.core;

/**
 * The unit of work. A step declares the configuration it reads and the output it produces, checks those
 * declarations against a {@link Context} without side effects, and then executes against the context plus the
 * working artifact handed over by its predecessor.
 *
 * <p>Execution may have side effects. Nothing is rolled back when a later step fails; whatever a side effect yields
 * (a row count, a location) belongs in the returned {@link Output}. Steps documented as idempotent report
 * {@link #idempotent()} so callers can decide whether a retry is safe; the framework itself never retries.
 *
 * <p>{@link Task} implements this interface too, so tasks nest to any depth.
 */
public interface Step {

    String name();

    /** Declared configuration paths and output schema. Fixed for the lifetime of the instance. */
    Requirements declareRequirements();

    default StepKind kind() {
        return StepKind.GENERIC;
    }

    /** Whether executing twice with the same context and input yields an identical output. */
    default boolean idempotent() {
        return false;
    }

    /**
     * Checks the declared requirements, and any precondition on the resolved configuration, against
     * {@code context}. Reads only.
     */
    void validate(Context context) throws ConfigResolutionException, ValidationException;

    /**
     * Runs the domain logic. The returned output satisfies {@link Requirements#output()}.
     *
     * @param input the working artifact; {@link Output#empty()} for the first step of a run
     */
    Output execute(Context context, Output input) throws StepException;

    /** Validates and executes, reporting the outcome as a value. Inherits the thread's cancellation token. */
    default StepResult run(Context context, Output input) {
        return Steps.run(this, context, input, CancellationToken.current());
    }

    /** Validates and executes with {@code token} bound for the duration of the run. */
    default StepResult run(Context context, Output input, CancellationToken token) {
        return Steps.run(this, context, input, token);
    }

    /** Runs against the {@link BootContext} with an empty input. */
    default StepResult run() {
        return run(BootContext.get(), Output.empty());
    }
}
