package com.graphflow.state;

/**
 * Thrown when a snapshot id is not present in a run's snapshot store.
 */
public final class UnknownSnapshotException extends IllegalArgumentException {

    private final String snapshotId;

    public UnknownSnapshotException(String snapshotId) {
        super("Unknown snapshot: " + snapshotId);
        this.snapshotId = snapshotId;
    }

    public String getSnapshotId() {
        return snapshotId;
    }
}
