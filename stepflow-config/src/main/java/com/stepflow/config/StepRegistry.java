package com.stepflow.config;

import com.stepflow.core.Step;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Named step factories that task definitions refer to with {@code "$ref"}. A factory may hand out a fresh step per
 * reference or the same shared instance; steps hold no per-run state, so sharing is safe.
 */
public final class StepRegistry {
    private final Map<String, Supplier<? extends Step>> factories = new ConcurrentHashMap<>();
    private volatile boolean reflectionEnabled = true;

    public StepRegistry register(String name, Supplier<? extends Step> factory) {
        factories.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    /** Registers a shared instance under its own name. */
    public StepRegistry register(Step step) {
        Objects.requireNonNull(step, "step");
        return register(step.name(), () -> step);
    }

    public boolean has(String name) {
        return factories.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(factories.keySet());
    }

    public Step create(String name) {
        Supplier<? extends Step> factory = factories.get(name);
        if (factory == null) throw new IllegalArgumentException("Unknown step: " + name);
        return Objects.requireNonNull(factory.get(), () -> "factory for '" + name + "' returned null");
    }

    /** Whether definitions may name step classes directly with {@code "$class"}. */
    public boolean reflectionEnabled() {
        return reflectionEnabled;
    }

    public StepRegistry reflectionEnabled(boolean enabled) {
        this.reflectionEnabled = enabled;
        return this;
    }
}
