package com.graphflow.engine;

import com.graphflow.engine.mode.AsyncMode;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.GraphValidationException;
import com.graphflow.graph.export.GraphVisualization;
import com.graphflow.graph.load.DirectoryConfigSource;
import com.graphflow.registry.UnknownTypeException;
import com.graphflow.state.StateContainer;
import com.graphflow.state.checkpoint.InMemoryCheckpointStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowEngineTest {

    private static final String LOOP_JSON = """
            {
              "workflowId": "counter",
              "entryPoint": "A",
              "nodes": [
                { "id": "A", "type": "noop" },
                { "id": "B", "type": "increment" },
                { "id": "C", "type": "end" }
              ],
              "edges": [
                { "from": "A", "to": "B" },
                { "from": "B", "to": "C", "guard": { "type": "greater_or_equal", "params": { "key": "count", "value": 3 } } },
                { "from": "B", "to": "B", "guard": { "type": "less_than", "params": { "key": "count", "value": 3 } } }
              ]
            }
            """;

    @TempDir
    Path dir;

    @Test
    void build_fromJsonAndRun() {
        WorkflowEngine engine = WorkflowEngine.builder().registries(NodeFixtures.nodeTypes()).build();

        GraphModel graph = engine.build(LOOP_JSON);
        StateContainer result = engine.run(graph, Map.of("count", 0));

        assertEquals("counter", graph.getWorkflowId());
        assertEquals(3, result.get("count"));
    }

    @Test
    void build_unknownNodeTypeFails() {
        WorkflowEngine engine = WorkflowEngine.builder().registries(NodeFixtures.nodeTypes()).build();

        assertThrows(UnknownTypeException.class, () -> engine.build(LOOP_JSON.replace("\"increment\"", "\"missing\"")));
    }

    @Test
    void build_strictValidationRejectsUnreachableNodes() {
        WorkflowEngine engine = WorkflowEngine.builder()
                .registries(NodeFixtures.nodeTypes())
                .config(EngineConfig.builder().strictValidation(true).build())
                .build();
        String json = LOOP_JSON.replace("{ \"id\": \"C\", \"type\": \"end\" }",
                "{ \"id\": \"C\", \"type\": \"end\" }, { \"id\": \"orphan\", \"type\": \"noop\" }");

        assertThrows(GraphValidationException.class, () -> engine.build(json));
    }

    @Test
    void registries_areCopiedAndFrozen() {
        WorkflowEngine engine = WorkflowEngine.builder().registries(NodeFixtures.nodeTypes()).build();

        assertThrows(IllegalStateException.class,
                () -> engine.getRegistries().registerNode("late", def -> null));
    }

    @Test
    void load_fromDirectorySource() throws Exception {
        Files.writeString(dir.resolve("counter.json"), LOOP_JSON);
        WorkflowEngine engine = WorkflowEngine.builder()
                .registries(NodeFixtures.nodeTypes())
                .configSource(new DirectoryConfigSource(dir))
                .build();

        StateContainer result = engine.run("counter", Map.of("count", 1));

        assertEquals(3, result.get("count"));
    }

    @Test
    void load_withoutSourceFails() {
        WorkflowEngine engine = WorkflowEngine.builder().registries(NodeFixtures.nodeTypes()).build();

        assertThrows(IllegalStateException.class, () -> engine.load("counter"));
    }

    @Test
    void runStream_andSnapshotThroughFacade() {
        WorkflowEngine engine = WorkflowEngine.builder()
                .registries(NodeFixtures.nodeTypes())
                .checkpointStore(new InMemoryCheckpointStore())
                .build();
        GraphModel graph = engine.build(LOOP_JSON);

        List<Object> counts;
        try (Stream<StateContainer> steps = engine.runStream(graph, Map.of("count", 0))) {
            counts = steps.map(s -> s.get("count")).collect(Collectors.toList());
        }
        RunHandle handle = engine.newRun(graph, Map.of("count", 0));
        String snapshotId = engine.snapshot(handle);
        engine.getOrchestrator().run(handle);
        engine.restore(handle, snapshotId);

        assertEquals(List.of(0, 1, 2, 3), counts);
        assertEquals(Map.of("count", 0), handle.values());
        assertEquals(handle.values(), handle.replayHistory());
    }

    @Test
    void runAsync_withAsyncMode() throws Exception {
        WorkflowEngine engine = WorkflowEngine.builder()
                .registries(NodeFixtures.nodeTypes())
                .mode(new AsyncMode())
                .build();
        GraphModel graph = engine.build(LOOP_JSON
                .replace("\"noop\"", "\"async_noop\"")
                .replace("\"increment\"", "\"async_increment\""));

        StateContainer result = engine.runAsync(graph, Map.of("count", 0)).get(5, TimeUnit.SECONDS);

        assertEquals(3, result.get("count"));
    }

    @Test
    void exportVisualization_listsNodesAndGuardedEdges() {
        WorkflowEngine engine = WorkflowEngine.builder().registries(NodeFixtures.nodeTypes()).build();

        GraphVisualization view = engine.exportVisualization(engine.build(LOOP_JSON));

        assertEquals("counter", view.workflowId());
        assertEquals("A", view.entryPoint());
        assertEquals(3, view.nodes().size());
        assertEquals(3, view.edges().size());
        assertTrue(view.edges().stream().anyMatch(e -> e.guard() != null && e.guard().startsWith("less_than")));
    }
}
