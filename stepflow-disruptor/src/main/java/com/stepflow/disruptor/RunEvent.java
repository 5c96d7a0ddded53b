package com.stepflow.disruptor;

import com.stepflow.core.CancellationToken;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.StepResult;

import java.util.concurrent.CompletableFuture;

/** Ring buffer slot for one submitted run. Slots are reused, so fields are cleared once the run completes. */
final class RunEvent {
    Context context;
    Output input;
    CancellationToken token;
    CompletableFuture<StepResult> result;

    void set(Context context, Output input, CancellationToken token, CompletableFuture<StepResult> result) {
        this.context = context;
        this.input = input;
        this.token = token;
        this.result = result;
    }

    void clear() {
        context = null;
        input = null;
        token = null;
        result = null;
    }
}
