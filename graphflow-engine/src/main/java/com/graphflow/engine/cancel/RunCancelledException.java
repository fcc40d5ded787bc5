package com.graphflow.engine.cancel;

import java.util.concurrent.CancellationException;

/**
 * The run was cancelled (explicitly or by its deadline). History up to the last completed step is kept.
 */
public final class RunCancelledException extends CancellationException {

    private final String executionId;
    private final boolean deadlineExceeded;

    public RunCancelledException(String executionId, boolean deadlineExceeded) {
        super("Run " + executionId + (deadlineExceeded ? " exceeded its deadline" : " was cancelled"));
        this.executionId = executionId;
        this.deadlineExceeded = deadlineExceeded;
    }

    public String getExecutionId() {
        return executionId;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
