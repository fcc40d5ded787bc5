package com.graphflow.engine.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped cancellation. Checked by the orchestrator before each step and at each stream yield;
 * listeners let in-flight suspended work be cancelled cooperatively. A deadline is a cancellation
 * scheduled for later.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private enum Reason { NONE, CANCELLED, DEADLINE }

    private final String executionId;
    private final AtomicReference<Reason> reason = new AtomicReference<>(Reason.NONE);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public CancellationToken(String executionId) {
        this.executionId = executionId;
    }

    public void cancel() {
        trip(Reason.CANCELLED);
    }

    /** Cancels the run after {@code timeout} unless it was cancelled earlier. Zero or negative: no deadline. */
    public void cancelAfter(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return;
        CompletableFuture.runAsync(() -> trip(Reason.DEADLINE),
                CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public boolean isCancelled() {
        return reason.get() != Reason.NONE;
    }

    public boolean isDeadlineExceeded() {
        return reason.get() == Reason.DEADLINE;
    }

    /**
     * @throws RunCancelledException if cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw newException();
        }
    }

    public RunCancelledException newException() {
        return new RunCancelledException(executionId, isDeadlineExceeded());
    }

    /**
     * Registers a listener run once on cancellation (immediately if already cancelled).
     *
     * @return handle that removes the listener
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /** Ends the token's life with its run: later cancellations and deadlines are ignored. */
    public void close() {
        closed = true;
        listeners.clear();
    }

    private void trip(Reason r) {
        if (closed || !reason.compareAndSet(Reason.NONE, r)) return;
        log.info("Run cancellation requested | executionId={} | reason={}", executionId, r);
        for (Runnable listener : listeners) {
            if (!listeners.remove(listener)) continue;
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed | executionId={}", executionId, e);
            }
        }
    }
}
