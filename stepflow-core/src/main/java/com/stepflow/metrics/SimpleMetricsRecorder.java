package com.stepflow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onStepSuccess(String task, String stepName, long nanos) {
        Timer.builder(metric(task, stepName, "duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onStepError(String task, String stepName, Throwable t) {
        Counter.builder(metric(task, stepName, "errors"))
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public void onCancelled(String task, String stepName) {
        Counter.builder(metric(task, stepName, "cancellations")).register(registry).increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    public static String metric(String task, String step, String name) {
        return "stepflow.task." + task + ".step." + step + "." + name;
    }
}
