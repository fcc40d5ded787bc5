package com.graphflow.state;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-run store of snapshots in creation order.
 */
public final class SnapshotStore {

    private final Map<String, Snapshot> byId = new LinkedHashMap<>();

    /** Takes a snapshot of the container's current values and revision. */
    public synchronized Snapshot create(StateContainer state, String label) {
        Snapshot snapshot = new Snapshot(UUID.randomUUID().toString(), state.getRevision(), state.values(),
                Instant.now(), label);
        byId.put(snapshot.getId(), snapshot);
        return snapshot;
    }

    /** Adds an existing snapshot (e.g. when resuming from a checkpoint). */
    public synchronized void add(Snapshot snapshot) {
        byId.put(snapshot.getId(), snapshot);
    }

    /**
     * @throws UnknownSnapshotException if absent
     */
    public synchronized Snapshot get(String snapshotId) {
        Snapshot s = byId.get(snapshotId);
        if (s == null) throw new UnknownSnapshotException(snapshotId);
        return s;
    }

    public synchronized Optional<Snapshot> find(String snapshotId) {
        return Optional.ofNullable(byId.get(snapshotId));
    }

    public synchronized List<Snapshot> list() {
        return List.copyOf(byId.values());
    }

    public synchronized int size() {
        return byId.size();
    }

    /** Delta that turns snapshot {@code fromId} into snapshot {@code toId}. */
    public synchronized StateDelta diff(String fromId, String toId) {
        return StateDiff.between(get(fromId).getValues(), get(toId).getValues());
    }
}
