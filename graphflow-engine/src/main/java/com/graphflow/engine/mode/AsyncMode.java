package com.graphflow.engine.mode;

import com.graphflow.graph.Node;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;

import java.util.concurrent.CompletableFuture;

/**
 * Suspending mode: calls {@code runAsync} and completes when the node's stage completes. Sync-only nodes
 * fail with {@link ModeMismatchException} before anything is invoked, so the caller's thread is never
 * blocked. Cancelling the returned future cancels the in-flight attempt.
 */
public final class AsyncMode implements ExecutionMode {

    public static final String NAME = "async";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsBlockingRuns() {
        return false;
    }

    @Override
    public boolean supportsSuspendingRuns() {
        return true;
    }

    @Override
    public NodeExecutionResult runNode(Node node, StateContainer state, ExecutionContext context) {
        throw new ModeMismatchException(node.getId(), node.getCapability(), NAME, "blocking");
    }

    @Override
    public CompletableFuture<NodeExecutionResult> runNodeAsync(Node node, StateContainer state,
                                                               ExecutionContext context) {
        if (!node.getCapability().supportsAsync()) {
            return CompletableFuture.failedFuture(
                    new ModeMismatchException(node.getId(), node.getCapability(), NAME, "suspending"));
        }
        return NodeRetrier.runAsync(node, state, context);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
