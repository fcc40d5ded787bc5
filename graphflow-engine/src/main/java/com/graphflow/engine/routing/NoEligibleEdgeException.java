package com.graphflow.engine.routing;

import java.util.Map;

/**
 * A non-terminal node has outgoing edges but none is eligible for the current state.
 */
public final class NoEligibleEdgeException extends IllegalStateException {

    private final String nodeId;
    private final Map<String, Object> state;

    public NoEligibleEdgeException(String nodeId, Map<String, Object> state) {
        super("No eligible outgoing edge from non-terminal node '" + nodeId + "' for state " + state);
        this.nodeId = nodeId;
        this.state = Map.copyOf(withoutNulls(state));
    }

    public String getNodeId() {
        return nodeId;
    }

    /** State values at routing time (null values omitted). */
    public Map<String, Object> getState() {
        return state;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> state) {
        Map<String, Object> out = new java.util.LinkedHashMap<>();
        state.forEach((k, v) -> {
            if (v != null) out.put(k, v);
        });
        return out;
    }
}
