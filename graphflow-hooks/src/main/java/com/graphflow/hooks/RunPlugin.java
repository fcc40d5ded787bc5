package com.graphflow.hooks;

import com.graphflow.node.ExecutionContext;
import com.graphflow.state.StateContainer;

/**
 * Run-level hook for concerns spanning the whole run.
 */
public interface RunPlugin {

    default void onRunStart(ExecutionContext context) {
    }

    /** Invoked once when the run completed. {@code finalState} must not be modified. */
    default void onRunEnd(ExecutionContext context, StateContainer finalState) {
    }

    /** Invoked once when the run failed or was cancelled. Failures here are always logged and never rethrown. */
    default void onError(ExecutionContext context, Throwable error) {
    }
}
