package com.graphflow.hooks;

import com.graphflow.node.NodeExecutionResult;

/**
 * Node-level hook. Side effects only: a trigger never mutates state directly; it may request an amendment
 * through {@link NodeHookContext#requestAmendment}, which the orchestrator applies as a separate history entry.
 */
public interface Trigger {

    /**
     * Invoked before the node executes.
     *
     * @return false to skip the node (recorded in history as SKIPPED; routing continues from the node)
     */
    default boolean before(NodeHookContext context) {
        return true;
    }

    /** Invoked after the node executed successfully and its output was committed. */
    default void after(NodeHookContext context, NodeExecutionResult result) {
    }

    /** Invoked when a before-trigger vetoed the node; {@code vetoedBy} is that trigger's name. */
    default void onSkipped(NodeHookContext context, String vetoedBy) {
    }

    /** Invoked once when the node failed for good (after its retries). */
    default void onNodeError(NodeHookContext context, Throwable error) {
    }
}
