package com.stepflow.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Ordered set of output field declarations for one step type. */
public final class OutputSchema {
    private static final OutputSchema EMPTY = new OutputSchema(Map.of());

    private final Map<String, FieldSpec> fields;

    private OutputSchema(Map<String, FieldSpec> fields) {
        this.fields = fields;
    }

    public static OutputSchema empty() {
        return EMPTY;
    }

    public static OutputSchema of(FieldSpec... specs) {
        return of(List.of(specs));
    }

    public static OutputSchema of(Collection<FieldSpec> specs) {
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec spec : specs) {
            if (byName.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("duplicate output field: " + spec.name());
            }
        }
        return byName.isEmpty() ? EMPTY : new OutputSchema(Collections.unmodifiableMap(byName));
    }

    public Collection<FieldSpec> fields() {
        return fields.values();
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean declares(String name) {
        return fields.containsKey(name);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /** Union of both schemas; declarations in {@code later} replace same-named ones. */
    public OutputSchema merge(OutputSchema later) {
        Objects.requireNonNull(later, "later");
        if (later.isEmpty()) return this;
        if (isEmpty()) return later;
        Map<String, FieldSpec> merged = new LinkedHashMap<>(fields);
        merged.putAll(later.fields);
        return new OutputSchema(Collections.unmodifiableMap(merged));
    }

    public List<String> violations(Output output) {
        List<String> problems = new ArrayList<>();
        for (FieldSpec spec : fields.values()) {
            String problem = spec.violation(output.has(spec.name()), output.find(spec.name()).orElse(null));
            if (problem != null) problems.add(problem);
        }
        return problems;
    }

    /**
     * Checks that {@code output} satisfies this schema.
     *
     * @throws StepExecutionException naming {@code stepName} when a declared field is missing or mistyped
     */
    public void verify(String stepName, Output output) throws StepExecutionException {
        List<String> problems = violations(output);
        if (!problems.isEmpty()) {
            throw new StepExecutionException(stepName,
                "output does not match declared schema: " + String.join("; ", problems), null);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OutputSchema other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "OutputSchema" + fields.values();
    }
}
