package com.graphflow.node;

import com.graphflow.state.StateContainer;

import java.util.concurrent.CompletionStage;

/**
 * Async-only node as a lambda returning a completion stage.
 */
@FunctionalInterface
public interface AsyncNode extends NodeImplementation {

    CompletionStage<NodeExecutionResult> executeAsync(StateContainer state, ExecutionContext context);

    @Override
    default ExecutionCapability capability() {
        return ExecutionCapability.ASYNC;
    }

    @Override
    default CompletionStage<NodeExecutionResult> runAsync(StateContainer state, ExecutionContext context) {
        return executeAsync(state, context);
    }
}
