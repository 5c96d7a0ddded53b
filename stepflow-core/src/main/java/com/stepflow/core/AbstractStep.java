package com.stepflow.core;

import org.slf4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Base for concrete steps. Subclasses pass their name, kind and requirements to the constructor and implement
 * {@link #doExecute}; this class checks the declared configuration, the kind's input field and the produced
 * output, and turns anything the domain code throws into a {@link StepExecutionException}.
 */
public abstract class AbstractStep implements Step {
    private final String name;
    private final StepKind kind;
    private final Requirements requirements;
    private final Logger log;

    protected AbstractStep(String name, Requirements requirements) {
        this(name, StepKind.GENERIC, requirements);
    }

    protected AbstractStep(String name, StepKind kind, Requirements requirements) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.requirements = Objects.requireNonNull(requirements, "requirements");
        if (name.isBlank()) throw new IllegalArgumentException("step name must not be blank");
        Optional<String> produced = kind.produces();
        if (produced.isPresent() && !requirements.output().declares(produced.get())) {
            throw new IllegalArgumentException(kind + " step '" + name + "' must declare output field '"
                + produced.get() + "'");
        }
        this.log = StepLoggers.forStep(name);
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final StepKind kind() {
        return kind;
    }

    @Override
    public final Requirements declareRequirements() {
        return requirements;
    }

    @Override
    public final void validate(Context context) throws ConfigResolutionException, ValidationException {
        Objects.requireNonNull(context, "context");
        requirements.check(name, context);
        checkPreconditions(context);
    }

    /** Hook for checks on already-resolved configuration. Must not have side effects. */
    protected void checkPreconditions(Context context) throws ValidationException {
    }

    @Override
    public final Output execute(Context context, Output input) throws StepException {
        Objects.requireNonNull(context, "context");
        Output in = input == null ? Output.empty() : input;
        Optional<String> consumed = kind.consumes();
        if (consumed.isPresent() && !in.has(consumed.get())) {
            throw new ValidationException(name, "input has no '" + consumed.get() + "' field (fields: "
                + in.names() + ")");
        }

        Output.Builder out = Output.builder(name, requirements.output());
        long t0 = System.nanoTime();
        log.debug("step.start name={} kind={}", name, kind);
        try {
            doExecute(context, in, out);
        } catch (StepException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException(name, "interrupted", e);
        } catch (Exception e) {
            throw new StepExecutionException(name, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        Output output = out.build();
        requirements.output().verify(name, output);
        if (log.isDebugEnabled()) {
            log.debug("step.end name={} durMs={} fields={}", name,
                String.format("%.3f", (System.nanoTime() - t0) / 1_000_000.0), output.names());
        }
        return output;
    }

    /**
     * Domain logic. Read configuration from {@code context}, the predecessor's result from {@code input}, and put
     * every declared field into {@code output}.
     */
    protected abstract void doExecute(Context context, Output input, Output.Builder output) throws Exception;

    protected Logger log() {
        return log;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
