package com.stepflow.metrics;

import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onStepSuccess(String task, String stepName, long nanos);
    void onStepError(String task, String stepName, Throwable t);
    void onCancelled(String task, String stepName);
    MeterRegistry registry();
}
