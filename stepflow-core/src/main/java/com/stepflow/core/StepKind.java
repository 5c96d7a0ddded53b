package com.stepflow.core;

import java.util.Optional;

/**
 * Role tag of a step, expressed by the data-set field it consumes from its input and the one it must declare in
 * its output.
 */
public enum StepKind {
    READER(null, Output.DATASET),
    TRANSFORMATION(Output.DATASET, Output.DATASET),
    WRITER(Output.DATASET, null),
    GENERIC(null, null);

    private final String consumes;
    private final String produces;

    StepKind(String consumes, String produces) {
        this.consumes = consumes;
        this.produces = produces;
    }

    public Optional<String> consumes() {
        return Optional.ofNullable(consumes);
    }

    public Optional<String> produces() {
        return Optional.ofNullable(produces);
    }
}
