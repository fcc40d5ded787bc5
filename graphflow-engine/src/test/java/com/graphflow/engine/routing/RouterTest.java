package com.graphflow.engine.routing;

import com.graphflow.engine.NodeFixtures;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.descriptor.GraphDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterTest {

    private final Router router = new Router();
    private GraphModel graph;

    @BeforeEach
    void setUp() {
        graph = NodeFixtures.build(NodeFixtures.registries(), GraphDescriptor.builder("routes")
                .node("A", "noop")
                .node("B", "noop")
                .node("C", "noop")
                .node("D", "noop")
                .edge("A", "B", "less_than", Map.of("key", "score", "value", 5))
                .edge("A", "C", "greater_or_equal", Map.of("key", "score", "value", 5))
                .edge("A", "D", "exists", Map.of("key", "review"))
                .edge("B", "D")
                .edge("B", "D")
                .edge("C", "D")
                .build());
    }

    @Test
    void resolveNext_keepsEligibleTargetsInEdgeOrder() {
        assertEquals(List.of("B"), router.resolveNext(graph, "A", Map.of("score", 1)));
        assertEquals(List.of("C", "D"), router.resolveNext(graph, "A", Map.of("score", 9, "review", true)));
    }

    @Test
    void resolveNext_dropsDuplicateTargets() {
        assertEquals(List.of("D"), router.resolveNext(graph, "B", Map.of()));
    }

    @Test
    void resolveNext_terminalNodeHasNoSuccessors() {
        assertTrue(router.resolveNext(graph, "D", Map.of()).isEmpty());
    }

    @Test
    void resolveNext_nothingEligibleOnNonTerminalNode() {
        Map<String, Object> state = new HashMap<>();
        state.put("score", null);

        NoEligibleEdgeException e = assertThrows(NoEligibleEdgeException.class,
                () -> router.resolveNext(graph, "A", state));

        assertEquals("A", e.getNodeId());
        assertTrue(e.getState().isEmpty());
    }
}
