package com.stepflow.core;

import java.util.List;
import java.util.stream.Collectors;

/** One or more required configuration paths are absent or hold a value of the wrong type. */
public final class ConfigResolutionException extends StepException {
    private final List<ContextException> problems;

    public ConfigResolutionException(String stepName, List<ContextException> problems) {
        super(stepName, describe(problems), problems.isEmpty() ? null : problems.get(0));
        this.problems = List.copyOf(problems);
        for (int i = 1; i < this.problems.size(); i++) {
            addSuppressed(this.problems.get(i));
        }
    }

    public ConfigResolutionException(String stepName, ContextException problem) {
        this(stepName, List.of(problem));
    }

    public List<ContextException> problems() {
        return problems;
    }

    public List<String> paths() {
        return problems.stream().map(ContextException::path).collect(Collectors.toList());
    }

    private static String describe(List<ContextException> problems) {
        if (problems.isEmpty()) throw new IllegalArgumentException("problems must not be empty");
        return "configuration not satisfied: "
            + problems.stream().map(Throwable::getMessage).collect(Collectors.joining("; "));
    }
}
