package com.graphflow.engine.checkpoint;

import com.graphflow.engine.RunHandle;
import com.graphflow.state.checkpoint.Checkpoint;
import com.graphflow.state.checkpoint.CheckpointStore;
import com.graphflow.state.checkpoint.NoOpCheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Fail-safe facade over a {@link CheckpointStore}: save failures are logged and never fail the run.
 * Loads are not masked, since resuming without the checkpoint is not possible.
 */
public final class CheckpointRecorder {

    private static final Logger log = LoggerFactory.getLogger(CheckpointRecorder.class);

    private final CheckpointStore store;

    public CheckpointRecorder(CheckpointStore store) {
        this.store = store != null ? store : new NoOpCheckpointStore();
    }

    public CheckpointStore getStore() {
        return store;
    }

    /** Saves the run's current image. */
    public void record(RunHandle handle) {
        try {
            Checkpoint checkpoint = handle.checkpoint();
            store.save(handle.getExecutionId(), checkpoint);
            log.debug("Checkpoint saved | executionId={} | status={} | steps={} | revision={}",
                    handle.getExecutionId(), checkpoint.getStatus(), checkpoint.getStepCount(),
                    checkpoint.getRevision());
        } catch (RuntimeException e) {
            log.warn("Checkpoint save failed; execution continues | executionId={} | error={}",
                    handle.getExecutionId(), e.getMessage(), e);
        }
    }

    public Optional<Checkpoint> load(String executionId) {
        return store.load(executionId);
    }
}
