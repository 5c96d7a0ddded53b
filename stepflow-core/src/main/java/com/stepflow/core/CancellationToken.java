package com.stepflow.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Cancellation signal for one run, cancelled explicitly or by a deadline. Tasks check it between children; a
 * running child is never interrupted.
 *
 * <p>{@link Step#run(Context, Output, CancellationToken)} binds the token to the calling thread for the duration of
 * the run, which is how nested tasks see the same signal without it being part of the step contract.
 */
public final class CancellationToken {
    private static final long NO_DEADLINE = 0L;
    private static final CancellationToken NONE = new CancellationToken(NO_DEADLINE, false);
    private static final ThreadLocal<CancellationToken> CURRENT = new ThreadLocal<>();

    private final long deadlineNanos;
    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationToken(long deadlineNanos, boolean cancellable) {
        this.deadlineNanos = deadlineNanos;
        this.cancellable = cancellable;
    }

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken(NO_DEADLINE, true);
    }

    /** A token that reports cancellation once {@code timeout} has elapsed, or earlier on {@link #cancel()}. */
    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long deadline = System.nanoTime() + timeout.toNanos();
        return new CancellationToken(deadline == NO_DEADLINE ? 1L : deadline, true);
    }

    /** Token bound to the current thread, or {@link #none()}. */
    public static CancellationToken current() {
        CancellationToken token = CURRENT.get();
        return token == null ? NONE : token;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        if (cancelled) return true;
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
    }

    /** Binds this token to the current thread until the returned binding is closed. */
    public Binding bind() {
        CancellationToken previous = CURRENT.get();
        CURRENT.set(this);
        return new Binding(previous);
    }

    public static final class Binding implements AutoCloseable {
        private final CancellationToken previous;

        private Binding(CancellationToken previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
