package com.graphflow.engine.mode;

import com.graphflow.graph.Node;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;

import java.util.concurrent.CompletableFuture;

/**
 * Fully blocking mode: calls {@code runSync} on the run's thread. Async-only nodes fail with
 * {@link ModeMismatchException}; no executor or event loop is ever created to run them.
 */
public final class SyncMode implements ExecutionMode {

    public static final String NAME = "sync";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsBlockingRuns() {
        return true;
    }

    @Override
    public boolean supportsSuspendingRuns() {
        return false;
    }

    @Override
    public NodeExecutionResult runNode(Node node, StateContainer state, ExecutionContext context) {
        if (!node.getCapability().supportsSync()) {
            throw new ModeMismatchException(node.getId(), node.getCapability(), NAME, "blocking");
        }
        return NodeRetrier.runBlocking(node, state, context);
    }

    @Override
    public CompletableFuture<NodeExecutionResult> runNodeAsync(Node node, StateContainer state,
                                                               ExecutionContext context) {
        return CompletableFuture.failedFuture(
                new ModeMismatchException(node.getId(), node.getCapability(), NAME, "suspending"));
    }

    @Override
    public String toString() {
        return NAME;
    }
}
