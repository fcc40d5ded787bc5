package com.graphflow.node;

import com.graphflow.state.StateContainer;

import java.util.concurrent.CompletionStage;

/**
 * Contract every node implementation satisfies. A node declares its {@link #capability()} and implements
 * the matching entry point(s). The default entry points throw: there is no built-in adaptation from one
 * style to the other, and an execution mode calls only the entry point the capability allows.
 * <p>
 * The state passed in is a working copy owned by this invocation; return it (or another container)
 * in the result. The engine computes the delta against the live state and commits it.
 */
public interface NodeImplementation {

    ExecutionCapability capability();

    /**
     * Blocking entry point. Called on the run's thread; blocks it until the node completes.
     */
    default NodeExecutionResult runSync(StateContainer state, ExecutionContext context) {
        throw new UnsupportedOperationException(getClass().getName() + " does not implement runSync");
    }

    /**
     * Suspending entry point. Must not block the calling thread; completes the stage when done.
     */
    default CompletionStage<NodeExecutionResult> runAsync(StateContainer state, ExecutionContext context) {
        throw new UnsupportedOperationException(getClass().getName() + " does not implement runAsync");
    }

    /** Retry policy applied by the execution mode on failure. Default: no retry. */
    default RetryPolicy retryPolicy() {
        return RetryPolicy.none();
    }
}
