package com.graphflow.engine.mode;

import com.graphflow.graph.Node;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;

import java.util.concurrent.CompletableFuture;

/**
 * Strategy that invokes node entry points. A mode is fixed for the lifetime of a run and is the single
 * place that decides which entry point of a node may be called: a node whose capability does not match
 * the call site fails with {@link ModeMismatchException}, never with a hidden bridge.
 * <p>
 * Both call sites receive the node's input state; implementations hand each attempt its own copy, so the
 * container passed in is never modified. Failures after retries surface as {@link NodeExecutionException}.
 */
public interface ExecutionMode {

    String name();

    /** Whether blocking runs ({@code run}, {@code runStream}) may use this mode. */
    boolean supportsBlockingRuns();

    /** Whether suspending runs ({@code runAsync}) may use this mode. */
    boolean supportsSuspendingRuns();

    /** Blocking call site: returns when the node has completed. */
    NodeExecutionResult runNode(Node node, StateContainer state, ExecutionContext context);

    /** Suspending call site: must not block the calling thread. Failures complete the future exceptionally. */
    CompletableFuture<NodeExecutionResult> runNodeAsync(Node node, StateContainer state, ExecutionContext context);
}
