package com.stepflow.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SimpleMetricsRecorderTest {

    @Test
    void recordsDurationsErrorsAndCancellationsPerStep() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SimpleMetricsRecorder recorder = new SimpleMetricsRecorder(registry);

        recorder.onStepSuccess("etl", "read", TimeUnit.MILLISECONDS.toNanos(5));
        recorder.onStepSuccess("etl", "read", TimeUnit.MILLISECONDS.toNanos(7));
        recorder.onStepError("etl", "write", new IllegalStateException("disk full"));
        recorder.onCancelled("etl", "write");

        assertEquals(2L, registry.get("stepflow.task.etl.step.read.duration").timer().count());
        assertEquals(12.0, registry.get("stepflow.task.etl.step.read.duration").timer()
            .totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1.0, registry.get("stepflow.task.etl.step.write.errors")
            .tag("exception", "IllegalStateException").counter().count());
        assertEquals(1.0, registry.get("stepflow.task.etl.step.write.cancellations").counter().count());
        assertSame(registry, recorder.registry());
    }

    @Test
    void defaultRecorderCanBeReplaced() {
        MetricsRecorder original = Metrics.recorder();
        SimpleMetricsRecorder replacement = new SimpleMetricsRecorder();
        try {
            Metrics.setRecorder(replacement);
            assertSame(replacement, Metrics.recorder());
        } finally {
            Metrics.setRecorder(original);
        }
        assertThrows(NullPointerException.class, () -> Metrics.setRecorder(null));
    }
}
