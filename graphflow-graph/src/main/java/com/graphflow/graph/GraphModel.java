package com.graphflow.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated graph: nodes in declaration order, edges in declaration order, entry point.
 * Structural queries only. Safe to share across concurrent runs.
 */
public final class GraphModel {

    private final String workflowId;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final String entryPoint;
    private final Map<String, Object> metadata;
    private final List<ValidationIssue> warnings;

    GraphModel(String workflowId, List<Node> nodes, List<Edge> edges, String entryPoint,
               Map<String, Object> metadata, List<ValidationIssue> warnings) {
        this.workflowId = workflowId;
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node n : nodes) byId.put(n.getId(), n);
        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(edges);
        Map<String, List<Edge>> out = new LinkedHashMap<>();
        for (Node n : nodes) out.put(n.getId(), new ArrayList<>());
        for (Edge e : edges) out.computeIfAbsent(e.getFrom(), k -> new ArrayList<>()).add(e);
        Map<String, List<Edge>> frozen = new LinkedHashMap<>();
        out.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.outgoing = Collections.unmodifiableMap(frozen);
        this.entryPoint = entryPoint;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public Collection<Node> nodes() {
        return nodes.values();
    }

    public List<Edge> edges() {
        return edges;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /** Non-fatal issues found at build time (e.g. unreachable nodes). */
    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    public Optional<Node> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * @throws IllegalArgumentException if the node does not exist
     */
    public Node node(String nodeId) {
        Node n = nodes.get(nodeId);
        if (n == null) {
            throw new IllegalArgumentException("No node '" + nodeId + "' in graph " + workflowId);
        }
        return n;
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /** Outgoing edges of the node in declaration order. */
    public List<Edge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /**
     * A node is terminal if it is an end marker, declares {@code terminal: true}, or has no outgoing edges.
     */
    public boolean isTerminal(String nodeId) {
        Node n = node(nodeId);
        return n.isTerminal() || n.isEndMarker() || outgoing(nodeId).isEmpty();
    }

    /** Node ids reachable from {@code start} (inclusive), in breadth-first order. */
    public Set<String> reachableFrom(String start) {
        Set<String> seen = new LinkedHashSet<>();
        if (!nodes.containsKey(start)) return seen;
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Edge e : outgoing(current)) {
                if (seen.add(e.getTo())) queue.add(e.getTo());
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    @Override
    public String toString() {
        return "GraphModel{workflowId=" + workflowId + ", nodes=" + nodes.size() + ", edges=" + edges.size()
                + ", entryPoint=" + entryPoint + "}";
    }
}
