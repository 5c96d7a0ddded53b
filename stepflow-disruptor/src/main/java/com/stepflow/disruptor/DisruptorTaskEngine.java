package com.stepflow.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.stepflow.core.CancellationToken;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.Step;
import com.stepflow.core.StepResult;
import com.stepflow.metrics.Metrics;
import com.stepflow.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs one step (usually a {@link com.stepflow.core.Task}) for many independent submissions on a fixed set of
 * handler threads fed by an LMAX Disruptor ring buffer.
 *
 * <p>Each submission carries its own context, input and cancellation token, and gets its own future; runs share
 * nothing but the immutable step. Handler {@code i} of {@code n} takes the sequences with {@code seq % n == i}, so
 * a single run never moves between threads. {@link #submit} blocks while the ring is full.
 *
 * <p>A run is claimed exactly once, either by the handler that starts it or by a timed-out {@link #shutdown} that
 * fails it, so no future is completed twice and no run starts after its future failed.
 */
public final class DisruptorTaskEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DisruptorTaskEngine.class);
    private static final String E2E = "e2e";

    private final String name;
    private final Step step;
    private final MetricsRecorder recorder;
    private final Disruptor<RunEvent> disruptor;
    private final RingBuffer<RunEvent> ring;
    private final Set<CompletableFuture<StepResult>> waiting = ConcurrentHashMap.newKeySet();
    private final ReadWriteLock state = new ReentrantReadWriteLock();
    private boolean running = true;

    public DisruptorTaskEngine(String name, int bufferSize, int workers, Step step) {
        this(name, bufferSize, workers, step, null);
    }

    /**
     * @param bufferSize ring size, a power of two
     * @param recorder   end-to-end timings per run; the process default when null
     */
    public DisruptorTaskEngine(String name, int bufferSize, int workers, Step step, MetricsRecorder recorder) {
        this.name = Objects.requireNonNull(name, "name");
        this.step = Objects.requireNonNull(step, "step");
        this.recorder = recorder;
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (Integer.bitCount(bufferSize) != 1) {
            throw new IllegalArgumentException("bufferSize must be a power of two: " + bufferSize);
        }

        this.disruptor = new Disruptor<>(RunEvent::new, bufferSize, DaemonThreadFactory.INSTANCE,
            ProducerType.MULTI, new BlockingWaitStrategy());
        RunHandler[] handlers = new RunHandler[workers];
        for (int i = 0; i < workers; i++) handlers[i] = new RunHandler(i, workers);
        disruptor.handleEventsWith(handlers);
        this.ring = disruptor.start();
        log.info("engine.start name={} step={} workers={} buffer={}", name, step.name(), workers, bufferSize);
    }

    public String name() {
        return name;
    }

    public CompletableFuture<StepResult> submit(Context context, Output input) {
        return submit(context, input, CancellationToken.none());
    }

    public CompletableFuture<StepResult> submit(Context context, Output input, CancellationToken token) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(token, "token");

        // the read lock keeps shutdown from starting between the running check and the publish
        state.readLock().lock();
        try {
            if (!running) throw new IllegalStateException("engine stopped");
            CompletableFuture<StepResult> result = new CompletableFuture<>();
            waiting.add(result);
            long seq = ring.next();
            try {
                ring.get(seq).set(context, input == null ? Output.empty() : input, token, result);
            } finally {
                ring.publish(seq);
            }
            return result;
        } finally {
            state.readLock().unlock();
        }
    }

    /** Remaining capacity of the ring, for callers that prefer shedding load over blocking. */
    public long remainingCapacity() {
        return ring.remainingCapacity();
    }

    /**
     * Stops accepting submissions and waits up to {@code timeout} for the submitted runs to finish. Runs that have
     * not started by then are completed exceptionally and never start; runs already executing complete normally.
     */
    public void shutdown(long timeout, TimeUnit unit) {
        state.writeLock().lock();
        try {
            if (!running) return;
            running = false;
        } finally {
            state.writeLock().unlock();
        }
        try {
            disruptor.shutdown(timeout, unit);
        } catch (TimeoutException e) {
            log.warn("engine.shutdown name={} timed out after {} {}, halting", name, timeout, unit);
            disruptor.halt();
            failPending();
        }
        log.info("engine.stop name={}", name);
    }

    public void shutdown() {
        shutdown(30, TimeUnit.SECONDS);
    }

    @Override
    public void close() {
        shutdown();
    }

    private void failPending() {
        int failed = 0;
        for (CompletableFuture<StepResult> pending : waiting) {
            if (waiting.remove(pending)) {
                pending.completeExceptionally(new IllegalStateException("engine '" + name + "' stopped before the run"));
                failed++;
            }
        }
        if (failed > 0) log.warn("engine.shutdown name={} failed {} runs that never started", name, failed);
    }

    private MetricsRecorder recorder() {
        return recorder != null ? recorder : Metrics.recorder();
    }

    private final class RunHandler implements EventHandler<RunEvent> {
        private final long ordinal;
        private final long count;

        private RunHandler(long ordinal, long count) {
            this.ordinal = ordinal;
            this.count = count;
        }

        @Override
        public void onEvent(RunEvent event, long sequence, boolean endOfBatch) {
            if (sequence % count != ordinal) return;
            CompletableFuture<StepResult> result = event.result;
            if (!waiting.remove(result)) {
                // already failed by a timed-out shutdown
                event.clear();
                return;
            }
            try {
                StepResult outcome = step.run(event.context, event.input, event.token);
                if (outcome.succeeded()) {
                    recorder().onStepSuccess(name, E2E, outcome.totalNanos());
                } else {
                    recorder().onStepError(name, E2E, outcome.error());
                }
                result.complete(outcome);
            } catch (Throwable t) {
                log.error("engine.run name={} seq={} failed outside the step contract", name, sequence, t);
                recorder().onStepError(name, E2E, t);
                result.completeExceptionally(t);
            } finally {
                event.clear();
            }
        }
    }
}
