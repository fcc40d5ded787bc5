package com.graphflow.graph.descriptor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Guard on an edge: registered guard type name plus its params.
 */
public final class GuardDescriptor {

    private final String type;
    private final Map<String, Object> params;

    @JsonCreator
    public GuardDescriptor(
            @JsonProperty("type") String type,
            @JsonProperty("params") Map<String, Object> params) {
        this.type = type;
        this.params = params != null ? Map.copyOf(params) : Map.of();
    }

    public static GuardDescriptor of(String type, Map<String, Object> params) {
        return new GuardDescriptor(type, params);
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GuardDescriptor that = (GuardDescriptor) o;
        return Objects.equals(type, that.type) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, params);
    }
}
