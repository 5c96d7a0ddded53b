package com.stepflow.core;

import java.util.List;
import java.util.Objects;

/** Factories for steps defined by a lambda, and the shared run-to-result routine. */
public final class Steps {
    private Steps() {}

    @FunctionalInterface
    public interface StepFunction {
        void apply(Context context, Output input, Output.Builder output) throws Exception;
    }

    public static Builder step(String name) {
        return new Builder(name);
    }

    public static Step of(String name, Requirements requirements, StepFunction fn) {
        return new LambdaStep(name, StepKind.GENERIC, requirements, false, fn);
    }

    public static Step of(String name, StepKind kind, Requirements requirements, StepFunction fn) {
        return new LambdaStep(name, kind, requirements, false, fn);
    }

    /**
     * Validates and executes {@code step} with {@code token} bound to the current thread. Never throws a
     * {@link StepException}; the failure is reported in the result.
     */
    public static StepResult run(Step step, Context context, Output input, CancellationToken token) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(token, "token");
        Output in = input == null ? Output.empty() : input;
        long t0 = System.nanoTime();
        StepRun run = new StepRun(step, 1);
        try (CancellationToken.Binding ignored = token.bind()) {
            run.validate(context);
            Output output = run.execute(context, in);
            List<StepTrace> trace = step instanceof Task ? output.trace() : List.of(run.trace());
            return new StepResult(step.name(), output, null, trace, System.nanoTime() - t0);
        } catch (StepException e) {
            return new StepResult(step.name(), null, e, traceOf(e, run), System.nanoTime() - t0);
        }
    }

    private static List<StepTrace> traceOf(StepException e, StepRun run) {
        if (e instanceof CompositionException composition) return composition.trace();
        if (e instanceof TaskCancelledException cancelled) return cancelled.trace();
        return List.of(run.trace());
    }

    public static final class Builder {
        private final String name;
        private final Requirements.Builder requirements = Requirements.builder();
        private StepKind kind = StepKind.GENERIC;
        private boolean idempotent;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder kind(StepKind kind) { this.kind = Objects.requireNonNull(kind, "kind"); return this; }
        public Builder requires(String path, Class<?> type) { requirements.config(path, type); return this; }
        public Builder output(String field, Class<?> type) { requirements.output(field, type); return this; }
        public Builder optionalOutput(String field, Class<?> type) { requirements.optionalOutput(field, type); return this; }
        public Builder idempotent(boolean b) { this.idempotent = b; return this; }

        public Step execute(StepFunction fn) {
            return new LambdaStep(name, kind, requirements.build(), idempotent, fn);
        }
    }

    private static final class LambdaStep extends AbstractStep {
        private final boolean idempotent;
        private final StepFunction fn;

        private LambdaStep(String name, StepKind kind, Requirements requirements, boolean idempotent, StepFunction fn) {
            super(name, kind, requirements);
            this.idempotent = idempotent;
            this.fn = Objects.requireNonNull(fn, "fn");
        }

        @Override
        public boolean idempotent() {
            return idempotent;
        }

        @Override
        protected void doExecute(Context context, Output input, Output.Builder output) throws Exception {
            fn.apply(context, input, output);
        }
    }
}
