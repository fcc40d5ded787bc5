package com.graphflow.graph.export;

import java.util.List;

/**
 * Read-only projection of a graph for external rendering.
 */
public record GraphVisualization(String workflowId, String entryPoint, List<NodeView> nodes, List<EdgeView> edges) {

    public GraphVisualization {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /** Capability is null for end markers. */
    public record NodeView(String id, String type, String capability, boolean terminal, boolean parallel,
                           String join, String description) {
    }

    /** Guard is null for unconditional edges. */
    public record EdgeView(String from, String to, String guard, String description) {
    }
}
