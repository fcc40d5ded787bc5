package com.graphflow.state.checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process CheckpointStore. Checkpoints are immutable, so stored instances are shared as-is.
 */
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> byExecutionId = new ConcurrentHashMap<>();

    @Override
    public void save(String executionId, Checkpoint checkpoint) {
        byExecutionId.put(executionId, checkpoint);
    }

    @Override
    public Optional<Checkpoint> load(String executionId) {
        return Optional.ofNullable(byExecutionId.get(executionId));
    }

    @Override
    public void delete(String executionId) {
        byExecutionId.remove(executionId);
    }

    public Set<String> executionIds() {
        return Set.copyOf(byExecutionId.keySet());
    }

    public void clear() {
        byExecutionId.clear();
    }
}
