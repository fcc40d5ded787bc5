package com.graphflow.graph.descriptor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raw graph description supplied by a {@link com.graphflow.graph.load.ConfigSource} or built in code.
 * Not validated; {@link com.graphflow.graph.GraphBuilder} turns it into a {@link com.graphflow.graph.GraphModel}.
 */
public final class GraphDescriptor {

    private final String workflowId;
    private final String entryPoint;
    private final List<NodeDescriptor> nodes;
    private final List<EdgeDescriptor> edges;
    private final Map<String, Object> metadata;

    @JsonCreator
    public GraphDescriptor(
            @JsonProperty("workflowId") String workflowId,
            @JsonProperty("entryPoint") String entryPoint,
            @JsonProperty("nodes") List<NodeDescriptor> nodes,
            @JsonProperty("edges") List<EdgeDescriptor> edges,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.workflowId = workflowId;
        this.entryPoint = entryPoint;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static Builder builder(String workflowId) {
        return new Builder(workflowId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public List<NodeDescriptor> getNodes() {
        return nodes;
    }

    public List<EdgeDescriptor> getEdges() {
        return edges;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /** Fluent construction for graphs declared in code. The first node added is the entry point unless set. */
    public static final class Builder {
        private final String workflowId;
        private String entryPoint;
        private final List<NodeDescriptor> nodes = new ArrayList<>();
        private final List<EdgeDescriptor> edges = new ArrayList<>();
        private Map<String, Object> metadata;

        private Builder(String workflowId) {
            this.workflowId = workflowId;
        }

        public Builder entryPoint(String nodeId) {
            this.entryPoint = nodeId;
            return this;
        }

        public Builder node(NodeDescriptor node) {
            nodes.add(node);
            if (entryPoint == null) entryPoint = node.getId();
            return this;
        }

        public Builder node(String id, String type) {
            return node(NodeDescriptor.of(id, type));
        }

        public Builder edge(EdgeDescriptor edge) {
            edges.add(edge);
            return this;
        }

        public Builder edge(String from, String to) {
            return edge(EdgeDescriptor.of(from, to));
        }

        public Builder edge(String from, String to, String guardType, Map<String, Object> guardParams) {
            return edge(EdgeDescriptor.guarded(from, to, GuardDescriptor.of(guardType, guardParams)));
        }

        public Builder metadata(Map<String, Object> value) {
            this.metadata = value;
            return this;
        }

        public GraphDescriptor build() {
            return new GraphDescriptor(workflowId, entryPoint, nodes, edges, metadata);
        }
    }
}
