package com.graphflow.graph.load;

import com.graphflow.graph.GraphBuilder;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.descriptor.GraphDescriptor;
import com.graphflow.graph.descriptor.GraphDescriptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads graphs by workflow id: asks each {@link ConfigSource} in order, parses the first descriptor found,
 * builds it and caches the model. A descriptor without a workflowId gets the requested id.
 */
public final class GraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);

    private final List<ConfigSource> sources;
    private final GraphBuilder builder;
    private final Map<String, GraphModel> cache = new ConcurrentHashMap<>();

    public GraphLoader(GraphBuilder builder, List<ConfigSource> sources) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.sources = List.copyOf(sources);
    }

    public GraphLoader(GraphBuilder builder, ConfigSource source) {
        this(builder, List.of(source));
    }

    /**
     * @throws NoSuchElementException if no source supplies the workflow
     * @throws com.graphflow.graph.GraphValidationException if the descriptor is invalid
     */
    public GraphModel load(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId");
        GraphModel cached = cache.get(workflowId);
        if (cached != null) return cached;
        GraphModel built = buildFromSources(workflowId);
        GraphModel existing = cache.putIfAbsent(workflowId, built);
        return existing != null ? existing : built;
    }

    /** Drops the cached model so the next {@link #load} reads the sources again. */
    public void invalidate(String workflowId) {
        cache.remove(workflowId);
    }

    private GraphModel buildFromSources(String workflowId) {
        for (ConfigSource source : sources) {
            Optional<String> json = source.getDescriptorJson(workflowId);
            if (json.isPresent()) {
                GraphDescriptor descriptor = GraphDescriptors.fromJson(json.get());
                if (descriptor.getWorkflowId() == null || descriptor.getWorkflowId().isBlank()) {
                    descriptor = new GraphDescriptor(workflowId, descriptor.getEntryPoint(), descriptor.getNodes(),
                            descriptor.getEdges(), descriptor.getMetadata());
                }
                log.info("Loaded graph descriptor | workflowId={} | source={}", workflowId,
                        source.getClass().getSimpleName());
                return builder.build(descriptor);
            }
        }
        throw new NoSuchElementException("No config source supplies workflow '" + workflowId + "'");
    }
}
