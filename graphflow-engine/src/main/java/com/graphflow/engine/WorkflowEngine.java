package com.graphflow.engine;

import com.graphflow.engine.mode.ExecutionMode;
import com.graphflow.engine.mode.SyncMode;
import com.graphflow.graph.GraphBuilder;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.descriptor.GraphDescriptor;
import com.graphflow.graph.descriptor.GraphDescriptors;
import com.graphflow.graph.export.GraphExport;
import com.graphflow.graph.export.GraphVisualization;
import com.graphflow.graph.guard.BuiltinGuards;
import com.graphflow.graph.load.ConfigSource;
import com.graphflow.graph.load.GraphLoader;
import com.graphflow.hooks.HookRegistry;
import com.graphflow.registry.ComponentRegistries;
import com.graphflow.state.StateContainer;
import com.graphflow.state.checkpoint.CheckpointStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Entry point wiring registries, graph building and loading, and one {@link Orchestrator}.
 * <pre>{@code
 * WorkflowEngine engine = WorkflowEngine.builder()
 *         .registries(new ComponentRegistries().registerNode("increment", NodeFactory.of(new IncrementNode())))
 *         .mode(new SyncMode())
 *         .build();
 * GraphModel graph = engine.build(descriptor);
 * StateContainer result = engine.run(graph, Map.of("count", 0));
 * }</pre>
 * The registries are copied and frozen when the engine is built; the built-in guards are added to the copy
 * unless disabled.
 */
public final class WorkflowEngine {

    private final ComponentRegistries registries;
    private final GraphBuilder graphBuilder;
    private final GraphLoader loader;
    private final Orchestrator orchestrator;

    private WorkflowEngine(Builder b) {
        EngineConfig config = b.config != null ? b.config : EngineConfig.defaults();
        ComponentRegistries copy = b.registries != null ? b.registries.copy() : new ComponentRegistries();
        if (b.builtinGuards) {
            BuiltinGuards.registerAll(copy.guards());
        }
        copy.freeze();
        this.registries = copy;
        this.graphBuilder = new GraphBuilder(copy, config.isStrictValidation());
        this.loader = b.sources.isEmpty() ? null : new GraphLoader(graphBuilder, b.sources);
        this.orchestrator = Orchestrator.builder()
                .mode(b.mode != null ? b.mode : new SyncMode())
                .hooks(b.hooks)
                .config(config)
                .checkpointStore(b.checkpointStore)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ComponentRegistries getRegistries() {
        return registries;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    /**
     * Validates and builds a graph.
     *
     * @throws com.graphflow.graph.GraphValidationException if the structure is invalid
     * @throws com.graphflow.registry.UnknownTypeException if a node or guard type is not registered
     */
    public GraphModel build(GraphDescriptor descriptor) {
        return graphBuilder.build(descriptor);
    }

    /** Parses a JSON descriptor and builds it. */
    public GraphModel build(String descriptorJson) {
        return graphBuilder.build(GraphDescriptors.fromJson(descriptorJson));
    }

    /**
     * Loads a graph from the configured sources (cached after the first load).
     *
     * @throws IllegalStateException if the engine has no config source
     * @throws java.util.NoSuchElementException if no source has the workflow
     */
    public GraphModel load(String workflowId) {
        if (loader == null) {
            throw new IllegalStateException("No config source configured; cannot load workflow " + workflowId);
        }
        return loader.load(workflowId);
    }

    public RunHandle newRun(GraphModel graph, Map<String, ?> initialValues) {
        return orchestrator.newRun(graph, initialValues);
    }

    public StateContainer run(GraphModel graph, Map<String, ?> initialValues) {
        return orchestrator.run(graph, initialValues);
    }

    public StateContainer run(String workflowId, Map<String, ?> initialValues) {
        return orchestrator.run(load(workflowId), initialValues);
    }

    public CompletableFuture<StateContainer> runAsync(GraphModel graph, Map<String, ?> initialValues) {
        return orchestrator.runAsync(orchestrator.newRun(graph, initialValues));
    }

    public Stream<StateContainer> runStream(GraphModel graph, Map<String, ?> initialValues) {
        return orchestrator.runStream(orchestrator.newRun(graph, initialValues));
    }

    public String snapshot(RunHandle handle) {
        return orchestrator.snapshot(handle);
    }

    public void restore(RunHandle handle, String snapshotId) {
        orchestrator.restore(handle, snapshotId);
    }

    /** Read-only node/edge projection of the graph for external rendering. */
    public GraphVisualization exportVisualization(GraphModel graph) {
        return GraphExport.toVisualization(graph);
    }

    public static final class Builder {
        private ComponentRegistries registries;
        private HookRegistry hooks;
        private ExecutionMode mode;
        private EngineConfig config;
        private CheckpointStore checkpointStore;
        private final List<ConfigSource> sources = new ArrayList<>();
        private boolean builtinGuards = true;

        public Builder registries(ComponentRegistries registries) {
            this.registries = registries;
            return this;
        }

        public Builder hooks(HookRegistry hooks) {
            this.hooks = hooks;
            return this;
        }

        /** Default: {@link SyncMode}. */
        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        /** Adds a source consulted by {@link WorkflowEngine#load}, after those added before. */
        public Builder configSource(ConfigSource source) {
            this.sources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        /** Whether to register the built-in guards (default true). */
        public Builder builtinGuards(boolean builtinGuards) {
            this.builtinGuards = builtinGuards;
            return this;
        }

        public WorkflowEngine build() {
            return new WorkflowEngine(this);
        }
    }
}
