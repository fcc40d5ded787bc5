package com.graphflow.state.checkpoint;

import java.util.Optional;

/**
 * Storage for run checkpoints, keyed by execution id. The engine calls it at configured step intervals
 * and at run end; failures are logged by the caller and never fail the run.
 */
public interface CheckpointStore {

    /** Saves (replaces) the checkpoint for the execution. */
    void save(String executionId, Checkpoint checkpoint);

    /** Loads the latest checkpoint for the execution, if any. */
    Optional<Checkpoint> load(String executionId);

    /** Deletes the checkpoint for the execution. Default: no-op. */
    default void delete(String executionId) {
        // no-op by default
    }
}
