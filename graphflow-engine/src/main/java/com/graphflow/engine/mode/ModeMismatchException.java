package com.graphflow.engine.mode;

import com.graphflow.node.ExecutionCapability;

/**
 * A node's execution capability does not match the call site of the active mode, or the mode cannot
 * drive the requested kind of run. Raised immediately; the engine never bridges one style to the other.
 */
public final class ModeMismatchException extends IllegalStateException {

    private final String nodeId;
    private final ExecutionCapability capability;
    private final String mode;

    public ModeMismatchException(String nodeId, ExecutionCapability capability, String mode, String callSite) {
        super("Node '" + nodeId + "' has capability " + capability + " and cannot run at the " + callSite
                + " call site of mode " + mode);
        this.nodeId = nodeId;
        this.capability = capability;
        this.mode = mode;
    }

    private ModeMismatchException(String mode, String message) {
        super(message);
        this.nodeId = null;
        this.capability = null;
        this.mode = mode;
    }

    /** The mode cannot drive a run of the given kind ("blocking" or "suspending"). */
    public static ModeMismatchException forRun(String mode, String runKind) {
        return new ModeMismatchException(mode, "Mode " + mode + " does not support " + runKind + " runs");
    }

    /** Offending node id; null when the mismatch concerns the run itself. */
    public String getNodeId() {
        return nodeId;
    }

    public ExecutionCapability getCapability() {
        return capability;
    }

    public String getMode() {
        return mode;
    }
}
