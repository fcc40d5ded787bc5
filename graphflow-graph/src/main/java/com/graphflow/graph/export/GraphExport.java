package com.graphflow.graph.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.graphflow.graph.Edge;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.Node;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects a {@link GraphModel} into a {@link GraphVisualization} and renders it as JSON or a Mermaid flowchart.
 */
public final class GraphExport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GraphExport() {
    }

    public static GraphVisualization toVisualization(GraphModel graph) {
        List<GraphVisualization.NodeView> nodes = new ArrayList<>();
        for (Node n : graph.nodes()) {
            nodes.add(new GraphVisualization.NodeView(
                    n.getId(),
                    n.getType(),
                    n.getCapability() != null ? n.getCapability().name() : null,
                    graph.isTerminal(n.getId()),
                    n.isParallel(),
                    n.getJoin(),
                    n.getDescription()));
        }
        List<GraphVisualization.EdgeView> edges = new ArrayList<>();
        for (Edge e : graph.edges()) {
            edges.add(new GraphVisualization.EdgeView(e.getFrom(), e.getTo(), e.getGuardLabel(), e.getDescription()));
        }
        return new GraphVisualization(graph.getWorkflowId(), graph.getEntryPoint(), nodes, edges);
    }

    public static String toJson(GraphModel graph) {
        try {
            return MAPPER.writeValueAsString(toVisualization(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Mermaid {@code flowchart TD}: end markers and terminal nodes as rounded boxes, parallel fan-out
     * nodes as hexagons, guards as edge labels.
     */
    public static String toMermaid(GraphModel graph) {
        StringBuilder sb = new StringBuilder("flowchart TD\n");
        for (Node n : graph.nodes()) {
            String label = escape(n.getId() + (n.isEndMarker() ? "" : " : " + n.getType()));
            sb.append("    ").append(mermaidId(n.getId()));
            if (n.isParallel()) {
                sb.append("{{\"").append(label).append("\"}}");
            } else if (graph.isTerminal(n.getId())) {
                sb.append("([\"").append(label).append("\"])");
            } else {
                sb.append("[\"").append(label).append("\"]");
            }
            sb.append('\n');
        }
        for (Edge e : graph.edges()) {
            sb.append("    ").append(mermaidId(e.getFrom()));
            if (e.getGuardLabel() != null) {
                sb.append(" -->|\"").append(escape(e.getGuardLabel())).append("\"| ");
            } else {
                sb.append(" --> ");
            }
            sb.append(mermaidId(e.getTo())).append('\n');
        }
        sb.append("    style ").append(mermaidId(graph.getEntryPoint())).append(" stroke-width:3px\n");
        return sb.toString();
    }

    private static String mermaidId(String nodeId) {
        return "n_" + nodeId.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
