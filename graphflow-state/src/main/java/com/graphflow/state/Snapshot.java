package com.graphflow.state;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time deep copy of state values, addressable by id.
 */
public final class Snapshot {

    private final String id;
    private final long revision;
    private final Map<String, Object> values;
    private final Instant createdAt;
    private final String label;

    public Snapshot(String id, long revision, Map<String, ?> values, Instant createdAt, String label) {
        this.id = Objects.requireNonNull(id, "id");
        this.revision = revision;
        this.values = Collections.unmodifiableMap(DeepCopy.copyMap(values));
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.label = label;
    }

    public String getId() {
        return id;
    }

    public long getRevision() {
        return revision;
    }

    /** Values at snapshot time. Unmodifiable. */
    public Map<String, Object> getValues() {
        return values;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Optional label (e.g. "auto:nodeId" for automatic checkpoints). May be null. */
    public String getLabel() {
        return label;
    }
}
