package com.graphflow.engine.mode;

import com.graphflow.node.ErrorInfo;

import java.util.Optional;

/**
 * A node failed after its retry policy was exhausted: it threw ({@link #getCause()}), reported an error in
 * its result ({@link #getReportedError()}), or returned no result at all.
 */
public final class NodeExecutionException extends RuntimeException {

    private final String nodeId;
    private final int attempts;
    private final transient ErrorInfo reportedError;

    public NodeExecutionException(String nodeId, int attempts, Throwable cause) {
        super("Node '" + nodeId + "' failed after " + attempts + " attempt(s): " + cause, cause);
        this.nodeId = nodeId;
        this.attempts = attempts;
        this.reportedError = null;
    }

    public NodeExecutionException(String nodeId, int attempts, ErrorInfo reportedError) {
        super("Node '" + nodeId + "' reported an error after " + attempts + " attempt(s): " + reportedError);
        this.nodeId = nodeId;
        this.attempts = attempts;
        this.reportedError = reportedError;
    }

    static NodeExecutionException nullResult(String nodeId, int attempts) {
        return new NodeExecutionException(nodeId, attempts,
                ErrorInfo.nonRetryable("NullResult", "node returned no result"));
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<ErrorInfo> getReportedError() {
        return Optional.ofNullable(reportedError);
    }
}
