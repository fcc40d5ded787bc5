package com.graphflow.graph;

import com.graphflow.graph.descriptor.GraphDescriptor;
import com.graphflow.graph.descriptor.NodeDescriptor;
import com.graphflow.graph.guard.BuiltinGuards;
import com.graphflow.node.AsyncNode;
import com.graphflow.node.ExecutionCapability;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.node.NodeFactory;
import com.graphflow.node.NodeImplementation;
import com.graphflow.node.SyncNode;
import com.graphflow.registry.ComponentRegistries;
import com.graphflow.registry.UnknownTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphBuilderTest {

    private ComponentRegistries registries;

    @BeforeEach
    void setUp() {
        registries = new ComponentRegistries();
        registries.registerNode("noop", NodeFactory.of((SyncNode) (state, ctx) -> NodeExecutionResult.of(state)));
        registries.registerNode("remote", NodeFactory.of(
                (AsyncNode) (state, ctx) -> CompletableFuture.completedFuture(NodeExecutionResult.of(state))));
        registries.registerNode("dual", NodeFactory.of(new NodeImplementation() {
            @Override
            public ExecutionCapability capability() {
                return ExecutionCapability.BOTH;
            }
        }));
        BuiltinGuards.registerAll(registries.guards());
    }

    private static GraphDescriptor loopGraph() {
        return GraphDescriptor.builder("loop")
                .node("A", "noop")
                .node("B", "noop")
                .node("C", "end")
                .edge("A", "B")
                .edge("B", "C", "greater_or_equal", Map.of("key", "count", "value", 3))
                .edge("B", "B", "less_than", Map.of("key", "count", "value", 3))
                .build();
    }

    @Test
    void build_loopGraph() {
        GraphModel graph = new GraphBuilder(registries).build(loopGraph());

        assertEquals("loop", graph.getWorkflowId());
        assertEquals("A", graph.getEntryPoint());
        assertEquals(3, graph.nodes().size());
        assertEquals(List.of("C", "B"), graph.outgoing("B").stream().map(Edge::getTo).toList());
        assertTrue(graph.isTerminal("C"));
        assertFalse(graph.isTerminal("B"));
        assertTrue(graph.node("C").isEndMarker());
        assertNull(graph.node("C").getImplementation());
        assertEquals(ExecutionCapability.SYNC, graph.node("A").getCapability());
        assertTrue(graph.getWarnings().isEmpty());
        assertEquals("greater_or_equal(key=count, value=3)", graph.outgoing("B").get(0).getGuardLabel());
    }

    @Test
    void build_collectsAllStructuralErrors() {
        GraphDescriptor descriptor = GraphDescriptor.builder("broken")
                .entryPoint("missing")
                .node("A", "noop")
                .node("A", "noop")
                .edge("A", "nowhere")
                .edge("ghost", "A")
                .build();

        GraphValidationException ex = assertThrows(GraphValidationException.class,
                () -> new GraphBuilder(registries).build(descriptor));

        assertTrue(ex.hasIssue("UNKNOWN_ENTRY_POINT"));
        assertTrue(ex.hasIssue("DUPLICATE_NODE_ID"));
        assertTrue(ex.hasIssue("UNKNOWN_EDGE_TARGET"));
        assertTrue(ex.hasIssue("UNKNOWN_EDGE_SOURCE"));
    }

    @Test
    void build_unknownNodeTypeFailsWithUnknownType() {
        GraphDescriptor descriptor = GraphDescriptor.builder("g").node("A", "llm").build();
        UnknownTypeException ex = assertThrows(UnknownTypeException.class,
                () -> new GraphBuilder(registries).build(descriptor));
        assertEquals("nodes", ex.getNamespace());
        assertEquals("llm", ex.getTypeName());
    }

    @Test
    void build_unknownGuardTypeFailsWithUnknownType() {
        GraphDescriptor descriptor = GraphDescriptor.builder("g")
                .node("A", "noop").node("B", "noop")
                .edge("A", "B", "coin_flip", Map.of())
                .build();
        UnknownTypeException ex = assertThrows(UnknownTypeException.class,
                () -> new GraphBuilder(registries).build(descriptor));
        assertEquals("guards", ex.getNamespace());
    }

    @Test
    void build_unreachableNodeIsWarningUnlessStrict() {
        GraphDescriptor descriptor = GraphDescriptor.builder("g")
                .node("A", "noop")
                .node("orphan", "noop")
                .build();

        GraphModel graph = new GraphBuilder(registries).build(descriptor);
        assertEquals(1, graph.getWarnings().size());
        assertEquals("UNREACHABLE_NODE", graph.getWarnings().get(0).code());

        GraphValidationException ex = assertThrows(GraphValidationException.class,
                () -> new GraphBuilder(registries, true).build(descriptor));
        assertTrue(ex.hasIssue("UNREACHABLE_NODE"));
    }

    @Test
    void build_capabilityCanBeNarrowedButNotWidened() {
        GraphDescriptor narrowed = GraphDescriptor.builder("g")
                .node(NodeDescriptor.of("A", "dual").withCapability("async"))
                .build();
        assertEquals(ExecutionCapability.ASYNC, new GraphBuilder(registries).build(narrowed).node("A").getCapability());

        GraphDescriptor widened = GraphDescriptor.builder("g")
                .node(NodeDescriptor.of("A", "remote").withCapability("SYNC"))
                .build();
        GraphValidationException ex = assertThrows(GraphValidationException.class,
                () -> new GraphBuilder(registries).build(widened));
        assertTrue(ex.hasIssue("CAPABILITY_NOT_SUPPORTED"));
    }

    @Test
    void build_endNodeWithOutgoingEdgesRejected() {
        GraphDescriptor descriptor = GraphDescriptor.builder("g")
                .node("A", "noop").node("E", "end")
                .edge("A", "E").edge("E", "A")
                .build();
        GraphValidationException ex = assertThrows(GraphValidationException.class,
                () -> new GraphBuilder(registries).build(descriptor));
        assertTrue(ex.hasIssue("END_NODE_HAS_EDGES"));
    }

    @Test
    void build_joinMustExist() {
        GraphDescriptor descriptor = GraphDescriptor.builder("g")
                .node(NodeDescriptor.of("F", "noop").withParallel(true, "J"))
                .build();
        GraphValidationException ex = assertThrows(GraphValidationException.class,
                () -> new GraphBuilder(registries).build(descriptor));
        assertTrue(ex.hasIssue("UNKNOWN_JOIN_NODE"));
    }

    @Test
    void isTerminal_declaredTerminalWithEdges() {
        GraphDescriptor descriptor = GraphDescriptor.builder("g")
                .node(NodeDescriptor.of("A", "noop").withTerminal(true))
                .node("B", "noop")
                .edge("A", "B", "exists", Map.of("key", "next"))
                .build();
        GraphModel graph = new GraphBuilder(registries).build(descriptor);
        assertTrue(graph.isTerminal("A"));
        assertTrue(graph.isTerminal("B"));
        assertEquals(List.of("A", "B"), List.copyOf(graph.reachableFrom("A")));
    }
}
