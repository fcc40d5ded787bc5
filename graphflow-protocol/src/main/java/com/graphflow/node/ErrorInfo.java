package com.graphflow.node;

import java.util.Map;
import java.util.Objects;

/**
 * Error reported by a node in its result instead of throwing.
 */
public final class ErrorInfo {

    private final String type;
    private final String message;
    private final boolean retryable;
    private final Map<String, Object> details;

    public ErrorInfo(String type, String message, boolean retryable, Map<String, Object> details) {
        this.type = Objects.requireNonNull(type, "type");
        this.message = message != null ? message : "";
        this.retryable = retryable;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ErrorInfo of(String type, String message) {
        return new ErrorInfo(type, message, true, null);
    }

    public static ErrorInfo nonRetryable(String type, String message) {
        return new ErrorInfo(type, message, false, null);
    }

    public static ErrorInfo of(Throwable t) {
        return new ErrorInfo(t.getClass().getSimpleName(), t.getMessage(), true, null);
    }

    /** Error category (e.g. exception simple name or a node-defined code). */
    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    /** False if the node asks not to be retried regardless of its retry policy. */
    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
