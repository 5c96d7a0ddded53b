package com.stepflow.core;

import com.stepflow.metrics.Metrics;
import com.stepflow.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered composition of steps that is itself a {@link Step}.
 *
 * <p>Children run strictly in declaration order on the calling thread. For each child the task checks the bound
 * {@link CancellationToken}, derives the child's context, validates the child, maps the previous output into the
 * child's input and executes it. The first failure stops the run: later children are not invoked, completed
 * children are not compensated, and the failure is wrapped in a {@link CompositionException} naming the child,
 * its 1-based position and the children that completed. A nested task's failure is wrapped again by every
 * enclosing task, so the chain leads down to the leaf that failed.
 *
 * <p>Instances are immutable and hold no per-run state; one task can serve concurrent runs as long as each run has
 * its own input.
 */
public final class Task implements Step {
    private static final Logger log = LoggerFactory.getLogger(Task.class);

    private final String name;
    private final List<Child> children;
    private final Aggregation aggregation;
    private final boolean preflight;
    private final Requirements requirements;
    private final MetricsRecorder recorder;

    private Task(Builder builder) {
        this.name = builder.name;
        this.children = List.copyOf(builder.children);
        this.aggregation = builder.aggregation;
        this.preflight = builder.preflight;
        this.recorder = builder.recorder;

        OutputSchema schema = OutputSchema.empty();
        if (aggregation == Aggregation.LAST_WINS) {
            schema = children.get(children.size() - 1).step().declareRequirements().output();
        } else {
            for (Child child : children) {
                schema = schema.merge(child.step().declareRequirements().output());
            }
        }
        this.requirements = new Requirements(builder.config, schema);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * The task's own configuration needs plus the output schema implied by its aggregation policy. Children's
     * configuration is checked per child, against the context each child receives.
     */
    @Override
    public Requirements declareRequirements() {
        return requirements;
    }

    @Override
    public boolean idempotent() {
        return children.stream().allMatch(child -> child.step().idempotent());
    }

    public List<Step> steps() {
        return children.stream().map(Child::step).toList();
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    public boolean preflight() {
        return preflight;
    }

    public int size() {
        return children.size();
    }

    @Override
    public void validate(Context context) throws ConfigResolutionException, ValidationException {
        requirements.check(name, Objects.requireNonNull(context, "context"));
    }

    @Override
    public Output execute(Context context, Output input) throws StepException {
        Objects.requireNonNull(context, "context");
        MetricsRecorder rec = recorder != null ? recorder : Metrics.recorder();
        CancellationToken token = CancellationToken.current();
        long runStartNanos = System.nanoTime();
        log.info("task.start name={} steps={}", name, children.size());

        if (preflight) {
            preflight(context);
        }

        List<StepTrace> trace = new ArrayList<>(children.size());
        List<String> completed = new ArrayList<>(children.size());
        List<Output> outputs = new ArrayList<>(children.size());
        Output current = input == null ? Output.empty() : input;

        for (int i = 0; i < children.size(); i++) {
            Child child = children.get(i);
            String childName = child.step().name();
            int position = i + 1;

            if (token.isCancelled()) {
                rec.onCancelled(name, childName);
                log.info("task.cancelled name={} before={} position={}", name, childName, position);
                throw new TaskCancelledException(name, position, childName, completed, trace, null);
            }

            StepRun run = new StepRun(child.step(), position);
            try (StepLoggers.MdcScope ignored = StepLoggers.enter(name, childName, position)) {
                Context childContext = deriveContext(child, run, context);
                run.validate(childContext);
                Output childInput = mapInput(child, run, current);
                current = run.execute(childContext, childInput);
            } catch (TaskCancelledException e) {
                trace.add(run.trace());
                rec.onCancelled(name, childName);
                throw new TaskCancelledException(name, position, childName, completed, trace, e);
            } catch (StepException e) {
                trace.add(run.trace());
                rec.onStepError(name, childName, e);
                log.warn("task.step.failed name={} step={} position={} completed={}: {}",
                    name, childName, position, completed, e.getMessage());
                throw new CompositionException(name, position, childName, completed, trace, e);
            }

            trace.add(run.trace());
            completed.add(childName);
            outputs.add(current);
            rec.onStepSuccess(name, childName, run.elapsedNanos());
        }

        Output aggregate = aggregate(outputs);
        log.info("task.end name={} durMs={}", name,
            String.format("%.3f", (System.nanoTime() - runStartNanos) / 1_000_000.0));
        return aggregate.withTrace(name, requirements.output(), trace);
    }

    private void preflight(Context context) throws CompositionException {
        for (int i = 0; i < children.size(); i++) {
            Child child = children.get(i);
            StepRun run = new StepRun(child.step(), i + 1);
            try {
                run.validate(deriveContext(child, run, context));
            } catch (ConfigResolutionException | ValidationException e) {
                throw new CompositionException(name, i + 1, child.step().name(), List.of(), List.of(run.trace()), e);
            }
        }
    }

    private static Context deriveContext(Child child, StepRun run, Context context)
            throws ConfigResolutionException, ValidationException {
        String childName = child.step().name();
        try {
            Context derived = child.context().apply(context);
            if (derived == null) {
                throw failed(run, new ValidationException(childName, "context mapping returned no context"));
            }
            return derived;
        } catch (ContextException e) {
            throw failed(run, new ConfigResolutionException(childName, e));
        } catch (RuntimeException e) {
            throw failed(run, new ValidationException(childName, "context mapping failed: " + e, e));
        }
    }

    private static Output mapInput(Child child, StepRun run, Output previous) throws ValidationException {
        String childName = child.step().name();
        try {
            Output mapped = child.input().apply(childName, previous);
            if (mapped == null) {
                throw failed(run, new ValidationException(childName, "input mapping returned no output"));
            }
            return mapped;
        } catch (ValidationException e) {
            if (!run.state().isTerminal()) run.fail(e);
            throw e;
        } catch (RuntimeException e) {
            throw failed(run, new ValidationException(childName, "input mapping failed: " + e, e));
        }
    }

    private static <E extends StepException> E failed(StepRun run, E failure) {
        run.fail(failure);
        return failure;
    }

    private Output aggregate(List<Output> outputs) {
        if (aggregation == Aggregation.LAST_WINS) {
            return outputs.get(outputs.size() - 1);
        }
        Output.Builder merged = Output.builder(name, requirements.output());
        for (Output output : outputs) {
            merged.putAll(output);
        }
        return merged.build();
    }

    @Override
    public String toString() {
        return "Task[" + name + ", steps=" + steps().stream().map(Step::name).toList() + "]";
    }

    private record Child(Step step, InputMapping input, ContextMapping context) {
        private Child {
            step = Objects.requireNonNull(step, "step");
            input = Objects.requireNonNull(input, "input");
            context = Objects.requireNonNull(context, "context");
        }
    }

    public static final class Builder {
        private final String name;
        private final List<Child> children = new ArrayList<>();
        private final List<ConfigRequirement> config = new ArrayList<>();
        private Aggregation aggregation = Aggregation.LAST_WINS;
        private boolean preflight;
        private MetricsRecorder recorder;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("task name must not be blank");
        }

        public Builder add(Step step) {
            return add(step, InputMapping.identity(), ContextMapping.identity());
        }

        public Builder add(Step step, InputMapping input) {
            return add(step, input, ContextMapping.identity());
        }

        public Builder add(Step step, ContextMapping context) {
            return add(step, InputMapping.identity(), context);
        }

        public Builder add(Step step, InputMapping input, ContextMapping context) {
            children.add(new Child(step, input, context));
            return this;
        }

        public Builder addAll(List<? extends Step> steps) {
            for (Step step : steps) add(step);
            return this;
        }

        /** Child sees only the namespace at {@code path} of the task's context. */
        public Builder addScoped(Step step, String namespace) {
            return add(step, ContextMapping.namespace(namespace));
        }

        /** Child sees the task's context with {@code overrides} on top. */
        public Builder addWithOverrides(Step step, Map<String, ?> overrides) {
            return add(step, ContextMapping.overrides(overrides));
        }

        public Builder requires(String path, Class<?> type) {
            config.add(new ConfigRequirement(path, type));
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = Objects.requireNonNull(aggregation, "aggregation");
            return this;
        }

        /** Validate every child before executing the first one. */
        public Builder preflight(boolean b) {
            this.preflight = b;
            return this;
        }

        public Builder metrics(MetricsRecorder recorder) {
            this.recorder = Objects.requireNonNull(recorder, "recorder");
            return this;
        }

        public Task build() {
            if (children.isEmpty()) {
                throw new IllegalStateException("task '" + name + "' has no steps");
            }
            return new Task(this);
        }
    }
}
