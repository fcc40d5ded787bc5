package com.graphflow.node;

/**
 * Which entry point(s) a node implements. The execution mode is the only place that decides which
 * entry point is called; a node is never adapted from one style to the other.
 */
public enum ExecutionCapability {
    /** Blocking entry point only ({@link NodeImplementation#runSync}). */
    SYNC,
    /** Suspending entry point only ({@link NodeImplementation#runAsync}). */
    ASYNC,
    /** Both entry points. */
    BOTH;

    public boolean supportsSync() {
        return this == SYNC || this == BOTH;
    }

    public boolean supportsAsync() {
        return this == ASYNC || this == BOTH;
    }

    /** Parses a config value (case-insensitive); null or blank → null. */
    public static ExecutionCapability parse(String value) {
        if (value == null || value.isBlank()) return null;
        return ExecutionCapability.valueOf(value.trim().toUpperCase());
    }
}
