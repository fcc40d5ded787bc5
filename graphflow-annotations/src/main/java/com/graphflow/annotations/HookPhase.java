package com.graphflow.annotations;

/**
 * When a hook is invoked relative to node execution or the run lifecycle.
 */
public enum HookPhase {
    /** Invoked before the node executes; may veto the node. */
    BEFORE_NODE,
    /** Invoked after the node executes successfully. */
    AFTER_NODE,
    /** Invoked before and after each node. */
    AROUND_NODE,
    /** Invoked at run start, run end and on run error. */
    RUN
}
