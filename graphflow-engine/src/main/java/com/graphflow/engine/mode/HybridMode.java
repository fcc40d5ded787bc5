package com.graphflow.engine.mode;

import com.graphflow.graph.Node;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Routes each node to the primitive mode that matches it at the current call site.
 * <ul>
 *   <li>Blocking site: sync-capable nodes run through {@link SyncMode}; async-only nodes fail.</li>
 *   <li>Suspending site: async-capable nodes run through {@link AsyncMode}; sync-only nodes run through
 *   {@link SyncMode} on the configured blocking executor, or fail when none is configured.</li>
 * </ul>
 */
public final class HybridMode implements ExecutionMode {

    public static final String NAME = "hybrid";

    private final SyncMode sync;
    private final AsyncMode async;
    private final Executor blockingExecutor;

    /** Hybrid mode without a blocking executor: sync-only nodes fail in suspending runs. */
    public HybridMode() {
        this(null);
    }

    public HybridMode(Executor blockingExecutor) {
        this(new SyncMode(), new AsyncMode(), blockingExecutor);
    }

    public HybridMode(SyncMode sync, AsyncMode async, Executor blockingExecutor) {
        this.sync = Objects.requireNonNull(sync, "sync");
        this.async = Objects.requireNonNull(async, "async");
        this.blockingExecutor = blockingExecutor;
    }

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
        return true;
    }

    @Override
    public NodeExecutionResult runNode(Node node, StateContainer state, ExecutionContext context) {
        if (!node.getCapability().supportsSync()) {
            throw new ModeMismatchException(node.getId(), node.getCapability(), NAME, "blocking");
        }
        return sync.runNode(node, state, context);
    }

    @Override
    public CompletableFuture<NodeExecutionResult> runNodeAsync(Node node, StateContainer state,
                                                               ExecutionContext context) {
        if (node.getCapability().supportsAsync()) {
            return async.runNodeAsync(node, state, context);
        }
        if (blockingExecutor == null) {
            return CompletableFuture.failedFuture(
                    new ModeMismatchException(node.getId(), node.getCapability(), NAME, "suspending"));
        }
        return CompletableFuture.supplyAsync(() -> sync.runNode(node, state, context), blockingExecutor);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
