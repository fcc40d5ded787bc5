package com.graphflow.engine;

/**
 * Lifecycle of a run: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
