package com.graphflow.graph.export;

import com.graphflow.graph.GraphBuilder;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.descriptor.GraphDescriptor;
import com.graphflow.graph.descriptor.NodeDescriptor;
import com.graphflow.graph.guard.BuiltinGuards;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.node.NodeFactory;
import com.graphflow.node.SyncNode;
import com.graphflow.registry.ComponentRegistries;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphExportTest {

    private static GraphModel graph() {
        ComponentRegistries registries = new ComponentRegistries();
        registries.registerNode("noop", NodeFactory.of((SyncNode) (state, ctx) -> NodeExecutionResult.of(state)));
        BuiltinGuards.registerAll(registries.guards());
        return new GraphBuilder(registries).build(GraphDescriptor.builder("viz")
                .node(NodeDescriptor.of("F", "noop").withParallel(true, "J"))
                .node("G", "noop")
                .node("J", "end")
                .edge("F", "G")
                .edge("F", "J", "exists", Map.of("key", "skip"))
                .edge("G", "J")
                .build());
    }

    @Test
    void toVisualization_projectsNodesAndEdges() {
        GraphVisualization viz = GraphExport.toVisualization(graph());

        assertEquals("viz", viz.workflowId());
        assertEquals("F", viz.entryPoint());
        assertEquals(3, viz.nodes().size());
        GraphVisualization.NodeView f = viz.nodes().get(0);
        assertTrue(f.parallel());
        assertEquals("J", f.join());
        assertEquals("SYNC", f.capability());
        GraphVisualization.NodeView j = viz.nodes().get(2);
        assertTrue(j.terminal());
        assertNull(j.capability());
        assertNull(viz.edges().get(0).guard());
        assertEquals("exists(key=skip)", viz.edges().get(1).guard());
    }

    @Test
    void toMermaid_rendersShapesAndGuardLabels() {
        String mermaid = GraphExport.toMermaid(graph());

        assertTrue(mermaid.startsWith("flowchart TD\n"));
        assertTrue(mermaid.contains("n_F{{\"F : noop\"}}"));
        assertTrue(mermaid.contains("n_J([\"J\"])"));
        assertTrue(mermaid.contains("n_F -->|\"exists(key=skip)\"| n_J"));
        assertTrue(mermaid.contains("n_G --> n_J"));
    }

    @Test
    void toJson_containsWorkflowId() {
        assertTrue(GraphExport.toJson(graph()).contains("\"workflowId\" : \"viz\""));
    }
}
