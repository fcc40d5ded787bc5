package com.graphflow.node;

import java.util.Map;
import java.util.Objects;

/**
 * What a {@link NodeFactory} receives to build a node instance: the node's id, registered type name
 * and its config from the graph descriptor.
 */
public record NodeDefinition(String id, String type, Map<String, Object> config) {

    public NodeDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        config = config != null ? Map.copyOf(config) : Map.of();
    }

    @SuppressWarnings("unchecked")
    public <T> T configValue(String key, Class<T> valueType) {
        Object v = config.get(key);
        return (v != null && valueType.isInstance(v)) ? (T) v : null;
    }
}
