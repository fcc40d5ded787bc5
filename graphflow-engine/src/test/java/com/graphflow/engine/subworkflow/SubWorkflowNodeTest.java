package com.graphflow.engine.subworkflow;

import com.graphflow.engine.NodeFixtures;
import com.graphflow.engine.Orchestrator;
import com.graphflow.engine.RunHandle;
import com.graphflow.engine.RunStatus;
import com.graphflow.engine.cancel.RunCancelledException;
import com.graphflow.engine.mode.AsyncMode;
import com.graphflow.engine.mode.HybridMode;
import com.graphflow.engine.mode.SyncMode;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.descriptor.GraphDescriptor;
import com.graphflow.graph.descriptor.NodeDescriptor;
import com.graphflow.hooks.HookRegistry;
import com.graphflow.hooks.RunPlugin;
import com.graphflow.node.AsyncNode;
import com.graphflow.node.ExecutionCapability;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.node.NodeFactory;
import com.graphflow.node.SyncNode;
import com.graphflow.registry.ComponentRegistries;
import com.graphflow.state.StateContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubWorkflowNodeTest {

    private ComponentRegistries registries;
    private final Map<String, GraphModel> graphs = new HashMap<>();

    @BeforeEach
    void setUp() {
        registries = NodeFixtures.registries();
    }

    private GraphModel register(GraphDescriptor descriptor) {
        GraphModel graph = NodeFixtures.build(registries, descriptor);
        graphs.put(graph.getWorkflowId(), graph);
        return graph;
    }

    private GraphDescriptor parent(Map<String, Object> subConfig) {
        return GraphDescriptor.builder("parent")
                .node("A", "increment")
                .node(NodeDescriptor.of("S", SubWorkflowNode.TYPE, subConfig))
                .node("B", "increment")
                .edge("A", "S")
                .edge("S", "B")
                .build();
    }

    @Test
    void runSync_childResultReplacesParentValues() {
        Orchestrator child = new Orchestrator(new SyncMode());
        registries.registerNode(SubWorkflowNode.TYPE, SubWorkflowNode.factory(child, graphs::get));
        register(NodeFixtures.loop("increment"));
        GraphModel graph = register(parent(Map.of(SubWorkflowNode.WORKFLOW_KEY, "loop")));
        Orchestrator orchestrator = new Orchestrator(new SyncMode());
        RunHandle handle = orchestrator.newRun(graph, Map.of("count", 0));

        StateContainer result = orchestrator.run(handle);

        assertEquals(4, result.get("count"));
        assertEquals(List.of("A", "S", "B"),
                handle.getHistory().stream().map(e -> e.getNodeId()).toList());
        assertEquals(Map.of("count", 3), handle.getHistory().get(1).getDelta().getUpdates());
    }

    @Test
    void runSync_outputKeyNestsChildValues() {
        Orchestrator child = new Orchestrator(new SyncMode());
        registries.registerNode(SubWorkflowNode.TYPE, SubWorkflowNode.factory(child, graphs::get));
        register(NodeFixtures.loop("increment"));
        GraphModel graph = register(parent(Map.of(
                SubWorkflowNode.WORKFLOW_KEY, "loop",
                SubWorkflowNode.OUTPUT_KEY, "inner")));

        StateContainer result = new Orchestrator(new SyncMode()).run(graph, Map.of("count", 0));

        assertEquals(2, result.get("count"));
        assertEquals(Map.of("count", 3), result.get("inner"));
    }

    @Test
    void child_seesParentExecutionId() {
        AtomicReference<Object> parentId = new AtomicReference<>();
        registries.registerNode("probe", NodeFactory.of((SyncNode) (state, ctx) -> {
            parentId.set(ctx.getConfig().get(SubWorkflowNode.PARENT_EXECUTION_ID));
            return NodeExecutionResult.of(state);
        }));
        GraphModel childGraph = register(GraphDescriptor.builder("probe").node("P", "probe").build());
        registries.registerNode("inner", NodeFactory.of(new SubWorkflowNode(new Orchestrator(new SyncMode()), childGraph)));
        GraphModel graph = register(GraphDescriptor.builder("outer").node("S", "inner").build());
        Orchestrator orchestrator = new Orchestrator(new SyncMode());
        RunHandle handle = orchestrator.newRun(graph, Map.of());

        orchestrator.run(handle);

        assertEquals(handle.getExecutionId(), parentId.get());
    }

    @Test
    void runAsync_childDrivenBySuspendingMode() throws Exception {
        Orchestrator child = new Orchestrator(new AsyncMode());
        registries.registerNode(SubWorkflowNode.TYPE, SubWorkflowNode.factory(child, graphs::get));
        register(NodeFixtures.loop("async_noop", "async_increment"));
        GraphModel graph = register(GraphDescriptor.builder("parent")
                .node(NodeDescriptor.of("S", SubWorkflowNode.TYPE, Map.of(SubWorkflowNode.WORKFLOW_KEY, "loop")))
                .node("B", "async_increment")
                .edge("S", "B")
                .build());
        Orchestrator orchestrator = new Orchestrator(new AsyncMode());

        StateContainer result = orchestrator.runAsync(orchestrator.newRun(graph, Map.of("count", 0)))
                .get(5, TimeUnit.SECONDS);

        assertEquals(4, result.get("count"));
    }

    @Test
    void runAsync_cancellingParentCancelsChildRun() {
        AtomicReference<CompletableFuture<NodeExecutionResult>> pending = new AtomicReference<>();
        AtomicReference<Throwable> childError = new AtomicReference<>();
        registries.registerNode("hang", NodeFactory.of((AsyncNode) (state, ctx) -> {
            CompletableFuture<NodeExecutionResult> never = new CompletableFuture<>();
            pending.set(never);
            return never;
        }));
        GraphModel childGraph = register(GraphDescriptor.builder("hanging").node("H", "hang").build());
        HookRegistry childHooks = new HookRegistry().registerPlugin("errors", new RunPlugin() {
            @Override
            public void onError(ExecutionContext context, Throwable error) {
                childError.set(error);
            }
        });
        Orchestrator child = Orchestrator.builder().mode(new AsyncMode()).hooks(childHooks).build();
        registries.registerNode("inner", NodeFactory.of(new SubWorkflowNode(child, childGraph)));
        GraphModel graph = register(GraphDescriptor.builder("outer").node("S", "inner").build());
        Orchestrator orchestrator = new Orchestrator(new AsyncMode());
        RunHandle handle = orchestrator.newRun(graph, Map.of());

        CompletableFuture<StateContainer> future = orchestrator.runAsync(handle);
        awaitTrue(() -> pending.get() != null);
        orchestrator.cancel(handle);

        awaitTrue(() -> childError.get() != null);
        assertTrue(pending.get().isCancelled());
        assertInstanceOf(RunCancelledException.class, childError.get());
        assertThrows(RunCancelledException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(RunStatus.CANCELLED, handle.getStatus());
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertTrue(condition.getAsBoolean());
    }

    @Test
    void capability_followsChildMode() {
        GraphModel childGraph = register(GraphDescriptor.builder("single").node("X", "noop").build());

        assertEquals(ExecutionCapability.SYNC,
                new SubWorkflowNode(new Orchestrator(new SyncMode()), childGraph).capability());
        assertEquals(ExecutionCapability.ASYNC,
                new SubWorkflowNode(new Orchestrator(new AsyncMode()), childGraph).capability());
        assertEquals(ExecutionCapability.BOTH,
                new SubWorkflowNode(new Orchestrator(new HybridMode()), childGraph).capability());
    }

    @Test
    void factory_requiresWorkflowConfig() {
        registries.registerNode(SubWorkflowNode.TYPE,
                SubWorkflowNode.factory(new Orchestrator(new SyncMode()), graphs::get));

        assertThrows(IllegalArgumentException.class, () -> register(parent(Map.of())));
    }
}
