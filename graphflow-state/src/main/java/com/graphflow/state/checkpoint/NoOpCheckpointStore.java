package com.graphflow.state.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** No-op CheckpointStore used when checkpointing is not configured. */
public final class NoOpCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpCheckpointStore.class);

    @Override
    public void save(String executionId, Checkpoint checkpoint) {
        log.debug("Checkpoint (no-op): save | executionId={} | revision={}", executionId, checkpoint.getRevision());
    }

    @Override
    public Optional<Checkpoint> load(String executionId) {
        return Optional.empty();
    }
}
