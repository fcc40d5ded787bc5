package com.graphflow.engine;

/**
 * The run reached its step budget without reaching a terminal node.
 */
public final class StepLimitExceededException extends IllegalStateException {

    private final int limit;

    public StepLimitExceededException(int limit) {
        super("Run exceeded the maximum of " + limit + " steps");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
