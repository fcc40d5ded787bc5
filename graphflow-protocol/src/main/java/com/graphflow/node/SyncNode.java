package com.graphflow.node;

import com.graphflow.state.StateContainer;

/**
 * Sync-only node as a lambda: {@code (state, ctx) -> NodeExecutionResult.of(state.put("k", v))}.
 */
@FunctionalInterface
public interface SyncNode extends NodeImplementation {

    NodeExecutionResult execute(StateContainer state, ExecutionContext context);

    @Override
    default ExecutionCapability capability() {
        return ExecutionCapability.SYNC;
    }

    @Override
    default NodeExecutionResult runSync(StateContainer state, ExecutionContext context) {
        return execute(state, context);
    }
}
