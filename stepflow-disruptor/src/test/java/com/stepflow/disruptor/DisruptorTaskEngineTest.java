package com.stepflow.disruptor;

import com.stepflow.core.CancellationToken;
import com.stepflow.core.CompositionException;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.Step;
import com.stepflow.core.StepResult;
import com.stepflow.core.Steps;
import com.stepflow.core.Task;
import com.stepflow.core.TaskCancelledException;
import com.stepflow.metrics.SimpleMetricsRecorder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class DisruptorTaskEngineTest {

    private final Set<String> threads = ConcurrentHashMap.newKeySet();

    private Task squareTask() {
        Step read = Steps.step("read").requires("n", Integer.class).output("n", Integer.class)
            .execute((ctx, in, out) -> {
                threads.add(Thread.currentThread().getName());
                out.put("n", ctx.getInt("n"));
            });
        Step square = Steps.step("square").output("square", Integer.class)
            .execute((ctx, in, out) -> {
                int n = in.get("n", Integer.class);
                if (n < 0) throw new IllegalArgumentException("negative: " + n);
                out.put("square", n * n);
            });
        return Task.builder("squares").add(read).add(square).build();
    }

    @Test
    void everySubmissionGetsItsOwnResult() throws Exception {
        SimpleMetricsRecorder recorder = new SimpleMetricsRecorder();
        try (DisruptorTaskEngine engine = new DisruptorTaskEngine("squares", 64, 4, squareTask(), recorder)) {
            List<CompletableFuture<StepResult>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                futures.add(engine.submit(Context.of(Map.of("n", i)), Output.empty()));
            }
            for (int i = 0; i < 100; i++) {
                StepResult result = futures.get(i).get(10, TimeUnit.SECONDS);
                assertTrue(result.succeeded());
                assertEquals(i * i, result.output().get("square"));
                assertEquals(2, result.trace().size());
            }
        }
        assertEquals(4, threads.size());
        assertEquals(100L, recorder.registry()
            .get(SimpleMetricsRecorder.metric("squares", "e2e", "duration")).timer().count());
    }

    @Test
    void failedRunsCompleteNormallyWithTheError() throws Exception {
        try (DisruptorTaskEngine engine = new DisruptorTaskEngine("squares", 8, 2, squareTask())) {
            StepResult bad = engine.submit(Context.of(Map.of("n", -3)), Output.empty()).get(10, TimeUnit.SECONDS);
            StepResult good = engine.submit(Context.of(Map.of("n", 3)), Output.empty()).get(10, TimeUnit.SECONDS);

            CompositionException e = assertInstanceOf(CompositionException.class, bad.error());
            assertEquals("square", e.childName());
            assertEquals(List.of("read"), e.completed());
            assertEquals(9, good.output().get("square"));
        }
    }

    @Test
    void cancelledTokenIsHonouredPerSubmission() throws Exception {
        CancellationToken cancelled = CancellationToken.create();
        cancelled.cancel();
        try (DisruptorTaskEngine engine = new DisruptorTaskEngine("squares", 8, 1, squareTask())) {
            StepResult result = engine.submit(Context.of(Map.of("n", 2)), Output.empty(), cancelled)
                .get(10, TimeUnit.SECONDS);

            assertInstanceOf(TaskCancelledException.class, result.error());
        }
    }

    @Test
    void stoppedEngineRejectsSubmissions() {
        DisruptorTaskEngine engine = new DisruptorTaskEngine("squares", 8, 1, squareTask());
        engine.shutdown();
        engine.shutdown();

        assertThrows(IllegalStateException.class, () -> engine.submit(Context.empty(), Output.empty()));
    }

    @Test
    void bufferSizeMustBeAPowerOfTwo() {
        assertThrows(IllegalArgumentException.class, () -> new DisruptorTaskEngine("x", 100, 1, squareTask()));
        assertThrows(IllegalArgumentException.class, () -> new DisruptorTaskEngine("x", 8, 0, squareTask()));
    }

    @Test
    void timedOutShutdownFailsOnlyRunsThatNeverStarted() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        Set<Integer> executed = ConcurrentHashMap.newKeySet();
        Step slow = Steps.step("slow").requires("n", Integer.class).output("n", Integer.class)
            .execute((ctx, in, out) -> {
                executed.add(ctx.getInt("n"));
                started.countDown();
                Thread.sleep(400);
                out.put("n", ctx.getInt("n"));
            });
        DisruptorTaskEngine engine = new DisruptorTaskEngine("slow", 8, 1, slow);

        CompletableFuture<StepResult> inFlight = engine.submit(Context.of(Map.of("n", 1)), Output.empty());
        assertTrue(started.await(10, TimeUnit.SECONDS));
        CompletableFuture<StepResult> queued = engine.submit(Context.of(Map.of("n", 2)), Output.empty());

        engine.shutdown(50, TimeUnit.MILLISECONDS);

        ExecutionException stopped = assertThrows(ExecutionException.class, () -> queued.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, stopped.getCause());
        StepResult finished = inFlight.get(10, TimeUnit.SECONDS);
        assertTrue(finished.succeeded());
        assertEquals(1, finished.output().get("n"));
        assertEquals(Set.of(1), executed);
        assertThrows(IllegalStateException.class, () -> engine.submit(Context.empty(), Output.empty()));
    }
}
