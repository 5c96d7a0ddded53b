package com.stepflow.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** What a step declares up front: the configuration it reads and the output it produces. */
public record Requirements(List<ConfigRequirement> config, OutputSchema output) {
    private static final Requirements NONE = new Requirements(List.of(), OutputSchema.empty());

    public Requirements {
        config = List.copyOf(Objects.requireNonNull(config, "config"));
        output = Objects.requireNonNull(output, "output");
    }

    public static Requirements none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks every declared path against {@code context}.
     *
     * @throws ConfigResolutionException listing every path that is absent or of the wrong type
     */
    public void check(String stepName, Context context) throws ConfigResolutionException {
        List<ContextException> problems = new ArrayList<>();
        for (ConfigRequirement requirement : config) {
            ContextException problem = requirement.problem(context);
            if (problem != null) problems.add(problem);
        }
        if (!problems.isEmpty()) {
            throw new ConfigResolutionException(stepName, problems);
        }
    }

    public static final class Builder {
        private final List<ConfigRequirement> config = new ArrayList<>();
        private final List<FieldSpec> output = new ArrayList<>();

        private Builder() {}

        public Builder config(String path, Class<?> type) {
            config.add(new ConfigRequirement(path, type));
            return this;
        }

        public Builder output(String name, Class<?> type) {
            output.add(FieldSpec.required(name, type));
            return this;
        }

        public Builder optionalOutput(String name, Class<?> type) {
            output.add(FieldSpec.optional(name, type));
            return this;
        }

        public Builder output(FieldSpec spec) {
            output.add(Objects.requireNonNull(spec, "spec"));
            return this;
        }

        public Builder output(OutputSchema schema) {
            output.addAll(schema.fields());
            return this;
        }

        public Requirements build() {
            return new Requirements(config, OutputSchema.of(output));
        }
    }
}
