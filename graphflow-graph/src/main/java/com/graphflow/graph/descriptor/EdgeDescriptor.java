package com.graphflow.graph.descriptor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Edge from one node id to another. No guard = unconditional.
 */
public final class EdgeDescriptor {

    private final String from;
    private final String to;
    private final GuardDescriptor guard;
    private final String description;

    @JsonCreator
    public EdgeDescriptor(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("guard") GuardDescriptor guard,
            @JsonProperty("description") String description) {
        this.from = from;
        this.to = to;
        this.guard = guard;
        this.description = description;
    }

    public static EdgeDescriptor of(String from, String to) {
        return new EdgeDescriptor(from, to, null, null);
    }

    public static EdgeDescriptor guarded(String from, String to, GuardDescriptor guard) {
        return new EdgeDescriptor(from, to, guard, null);
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public GuardDescriptor getGuard() {
        return guard;
    }

    public String getDescription() {
        return description;
    }
}
