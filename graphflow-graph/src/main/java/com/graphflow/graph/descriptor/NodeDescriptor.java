package com.graphflow.graph.descriptor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Node as declared in a graph descriptor.
 * <ul>
 *   <li>{@code type}: registered node type name, or the reserved {@code end} marker.</li>
 *   <li>{@code capability}: optional narrowing of the implementation's capability (SYNC / ASYNC / BOTH).</li>
 *   <li>{@code terminal}: run may complete here even if outgoing edges exist but none is eligible.</li>
 *   <li>{@code parallel}: a fan-out from this node runs its branches concurrently on isolated copies.</li>
 *   <li>{@code join}: node where fan-out branches stop and the run continues after the merge.</li>
 * </ul>
 */
public final class NodeDescriptor {

    private final String id;
    private final String type;
    private final String capability;
    private final Map<String, Object> config;
    private final boolean terminal;
    private final boolean parallel;
    private final String join;
    private final String description;

    @JsonCreator
    public NodeDescriptor(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("capability") String capability,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("terminal") Boolean terminal,
            @JsonProperty("parallel") Boolean parallel,
            @JsonProperty("join") String join,
            @JsonProperty("description") String description) {
        this.id = id;
        this.type = type;
        this.capability = capability;
        this.config = config != null ? Map.copyOf(config) : Map.of();
        this.terminal = Boolean.TRUE.equals(terminal);
        this.parallel = Boolean.TRUE.equals(parallel);
        this.join = join;
        this.description = description;
    }

    public static NodeDescriptor of(String id, String type) {
        return new NodeDescriptor(id, type, null, null, null, null, null, null);
    }

    public static NodeDescriptor of(String id, String type, Map<String, Object> config) {
        return new NodeDescriptor(id, type, null, config, null, null, null, null);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getCapability() {
        return capability;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isParallel() {
        return parallel;
    }

    public String getJoin() {
        return join;
    }

    public String getDescription() {
        return description;
    }

    public NodeDescriptor withTerminal(boolean value) {
        return new NodeDescriptor(id, type, capability, config, value, parallel, join, description);
    }

    public NodeDescriptor withParallel(boolean value, String joinNodeId) {
        return new NodeDescriptor(id, type, capability, config, terminal, value, joinNodeId, description);
    }

    public NodeDescriptor withCapability(String value) {
        return new NodeDescriptor(id, type, value, config, terminal, parallel, join, description);
    }
}
