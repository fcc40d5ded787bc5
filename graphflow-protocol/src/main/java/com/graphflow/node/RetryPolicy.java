package com.graphflow.node;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Retry policy declared by a node: bounded attempts with exponential backoff.
 * Errors whose class simple name or fully qualified name is listed in {@link #getNonRetryableErrors()}
 * are never retried.
 */
public final class RetryPolicy {

    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, List.of());

    private final int maximumAttempts;
    private final Duration initialInterval;
    private final double backoffCoefficient;
    private final Duration maximumInterval;
    private final List<String> nonRetryableErrors;

    public RetryPolicy(int maximumAttempts, Duration initialInterval, double backoffCoefficient,
                       Duration maximumInterval, List<String> nonRetryableErrors) {
        if (maximumAttempts < 1) throw new IllegalArgumentException("maximumAttempts must be >= 1");
        if (backoffCoefficient < 1.0) throw new IllegalArgumentException("backoffCoefficient must be >= 1.0");
        this.maximumAttempts = maximumAttempts;
        this.initialInterval = initialInterval != null ? initialInterval : Duration.ZERO;
        this.backoffCoefficient = backoffCoefficient;
        this.maximumInterval = maximumInterval != null ? maximumInterval : this.initialInterval;
        this.nonRetryableErrors = nonRetryableErrors != null ? List.copyOf(nonRetryableErrors) : List.of();
    }

    /** Single attempt, no retry. */
    public static RetryPolicy none() {
        return NONE;
    }

    /** Up to {@code maximumAttempts} attempts, doubling from {@code initialInterval}, capped at 60s. */
    public static RetryPolicy exponential(int maximumAttempts, Duration initialInterval) {
        return new RetryPolicy(maximumAttempts, initialInterval, 2.0, Duration.ofSeconds(60), List.of());
    }

    public int getMaximumAttempts() {
        return maximumAttempts;
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public double getBackoffCoefficient() {
        return backoffCoefficient;
    }

    public Duration getMaximumInterval() {
        return maximumInterval;
    }

    public List<String> getNonRetryableErrors() {
        return nonRetryableErrors;
    }

    /**
     * @param attempt attempt that just failed (1-based)
     * @param error   failure of that attempt
     */
    public boolean shouldRetry(int attempt, Throwable error) {
        if (attempt >= maximumAttempts) return false;
        if (error == null) return true;
        String simple = error.getClass().getSimpleName();
        String full = error.getClass().getName();
        return !nonRetryableErrors.contains(simple) && !nonRetryableErrors.contains(full);
    }

    /**
     * Variant for errors a node reported in its result rather than threw; matched on {@link ErrorInfo#getType()}.
     */
    public boolean shouldRetry(int attempt, ErrorInfo error) {
        if (attempt >= maximumAttempts || !error.isRetryable()) return false;
        return !nonRetryableErrors.contains(error.getType());
    }

    /**
     * Delay before the given retry attempt (2-based: the first retry is attempt 2).
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1 || initialInterval.isZero()) return Duration.ZERO;
        double factor = Math.pow(backoffCoefficient, attempt - 2);
        long millis = (long) Math.min(initialInterval.toMillis() * factor, (double) maximumInterval.toMillis());
        return Duration.ofMillis(Math.max(0L, millis));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maximumAttempts == that.maximumAttempts
                && Double.compare(backoffCoefficient, that.backoffCoefficient) == 0
                && initialInterval.equals(that.initialInterval)
                && maximumInterval.equals(that.maximumInterval)
                && nonRetryableErrors.equals(that.nonRetryableErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maximumAttempts, initialInterval, backoffCoefficient, maximumInterval, nonRetryableErrors);
    }
}
