package com.stepflow.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named-field result of one step execution. Immutable once built; the {@link Builder} belongs to the executing
 * invocation until it hands the built value to its caller.
 */
public final class Output {
    /** Field through which readers, transformations and writers exchange their data set. */
    public static final String DATASET = "dataset";

    private static final ObjectMapper JSON = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private static final Output EMPTY = new Output("", OutputSchema.empty(), Map.of(), List.of());

    private final String producer;
    private final OutputSchema schema;
    private final Map<String, Object> fields;
    private final List<StepTrace> trace;

    private Output(String producer, OutputSchema schema, Map<String, Object> fields, List<StepTrace> trace) {
        this.producer = producer;
        this.schema = schema;
        this.fields = fields;
        this.trace = trace;
    }

    /** The artifact a top-level run starts from. */
    public static Output empty() {
        return EMPTY;
    }

    public static Builder builder(String producer, OutputSchema schema) {
        return new Builder(producer, schema);
    }

    /** Schema-less output, mainly for seeding a run with an initial artifact. */
    public static Output of(String producer, Map<String, ?> fields) {
        Builder builder = builder(producer, OutputSchema.empty());
        fields.forEach(builder::put);
        return builder.build();
    }

    public String producer() {
        return producer;
    }

    public OutputSchema schema() {
        return schema;
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Object get(String name) {
        if (!fields.containsKey(name)) {
            throw new NoSuchElementException("Output of '" + producer + "' has no field '" + name + "'");
        }
        return fields.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        Object value = get(name);
        if (!type.isInstance(value)) {
            throw new ClassCastException("Output field '" + name + "' of '" + producer + "' is "
                + (value == null ? "null" : value.getClass().getSimpleName()) + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Set<String> names() {
        return fields.keySet();
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /** Per-child trace when this output was assembled by a {@link Task}; empty for leaf steps. */
    public List<StepTrace> trace() {
        return trace;
    }

    Output withTrace(String producer, OutputSchema schema, List<StepTrace> trace) {
        return new Output(producer, schema, fields, List.copyOf(trace));
    }

    /** Deterministic JSON rendering of the fields; nested maps are written in key order. */
    public String toJson() {
        try {
            return JSON.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Output of '" + producer + "' is not serializable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Output other && producer.equals(other.producer) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(producer, fields);
    }

    @Override
    public String toString() {
        return "Output[" + producer + "]" + fields;
    }

    public static final class Builder {
        private final String producer;
        private final OutputSchema schema;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String producer, OutputSchema schema) {
            this.producer = Objects.requireNonNull(producer, "producer");
            this.schema = Objects.requireNonNull(schema, "schema");
        }

        public Builder put(String name, Object value) {
            fields.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder putAll(Output other) {
            fields.putAll(other.fields);
            return this;
        }

        public boolean has(String name) {
            return fields.containsKey(name);
        }

        public Output build() {
            return new Output(producer, schema, Collections.unmodifiableMap(new LinkedHashMap<>(fields)), List.of());
        }
    }
}
