package com.graphflow.node;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Read-only context of one run, passed to every node execution and every hook.
 */
public final class ExecutionContext {

    private final String workflowId;
    private final String executionId;
    private final Map<String, Object> config;
    private final Instant startedAt;
    private final BooleanSupplier cancellationSignal;

    public ExecutionContext(String workflowId, String executionId, Map<String, Object> config, Instant startedAt) {
        this(workflowId, executionId, config, startedAt, () -> false);
    }

    public ExecutionContext(String workflowId, String executionId, Map<String, Object> config, Instant startedAt,
                            BooleanSupplier cancellationSignal) {
        this.workflowId = workflowId != null ? workflowId : "";
        this.executionId = Objects.requireNonNull(executionId, "executionId");
        this.config = config != null ? Map.copyOf(config) : Map.of();
        this.startedAt = startedAt != null ? startedAt : Instant.now();
        this.cancellationSignal = cancellationSignal != null ? cancellationSignal : () -> false;
    }

    /** Same run identity and config, reporting cancellation through {@code signal}. */
    public ExecutionContext withCancellationSignal(BooleanSupplier signal) {
        return new ExecutionContext(workflowId, executionId, config, startedAt, signal);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    /** Run-level configuration (e.g. engine settings, caller-supplied parameters). Unmodifiable. */
    public Map<String, Object> getConfig() {
        return config;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * True once the run has been cancelled. Long-running nodes may poll it and stop early; a result returned
     * after cancellation is discarded anyway.
     */
    public boolean isCancelled() {
        return cancellationSignal.getAsBoolean();
    }

    @SuppressWarnings("unchecked")
    public <T> T getConfigValue(String key, Class<T> type) {
        Object v = config.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }

    @Override
    public String toString() {
        return "ExecutionContext{workflowId=" + workflowId + ", executionId=" + executionId + "}";
    }
}
