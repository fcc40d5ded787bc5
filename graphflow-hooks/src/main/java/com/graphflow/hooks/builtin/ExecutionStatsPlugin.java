package com.graphflow.hooks.builtin;

import com.graphflow.annotations.GraphHook;
import com.graphflow.annotations.HookPhase;
import com.graphflow.hooks.NodeHookContext;
import com.graphflow.hooks.RunPlugin;
import com.graphflow.hooks.Trigger;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects per-run execution statistics and logs a summary when the run ends.
 * Finished runs stay queryable through {@link #get(String)} until {@link #clear(String)}.
 */
@GraphHook(name = "execution-stats", phase = HookPhase.AROUND_NODE)
public final class ExecutionStatsPlugin implements Trigger, RunPlugin {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStatsPlugin.class);

    private final Map<String, Collector> active = new ConcurrentHashMap<>();
    private final Map<String, ExecutionStats> finished = new ConcurrentHashMap<>();

    @Override
    public void onRunStart(ExecutionContext context) {
        active.put(context.getExecutionId(), new Collector());
    }

    @Override
    public void after(NodeHookContext context, NodeExecutionResult result) {
        Collector c = active.get(context.getExecutionId());
        if (c != null) c.nodeRan(context.getNodeId(), context.getElapsed());
    }

    @Override
    public void onNodeError(NodeHookContext context, Throwable error) {
        Collector c = active.get(context.getExecutionId());
        if (c != null) c.nodeFailed();
    }

    @Override
    public void onSkipped(NodeHookContext context, String vetoedBy) {
        Collector c = active.get(context.getExecutionId());
        if (c != null) c.nodeSkipped();
    }

    @Override
    public void onRunEnd(ExecutionContext context, StateContainer finalState) {
        finish(context, true);
    }

    @Override
    public void onError(ExecutionContext context, Throwable error) {
        finish(context, false);
    }

    public Optional<ExecutionStats> get(String executionId) {
        return Optional.ofNullable(finished.get(executionId));
    }

    public void clear(String executionId) {
        finished.remove(executionId);
    }

    private void finish(ExecutionContext context, boolean succeeded) {
        Collector c = active.remove(context.getExecutionId());
        if (c == null) return;
        ExecutionStats stats = c.toStats(context, succeeded);
        finished.put(context.getExecutionId(), stats);
        log.info("Execution stats | executionId={} | succeeded={} | nodeRuns={} | skipped={} | failures={} | totalMs={} | slowest={}",
                stats.executionId(), succeeded, stats.totalNodeRuns(), stats.skipped(), stats.failures(),
                stats.totalDuration().toMillis(), stats.slowestNodeId());
    }

    private static final class Collector {
        private final Instant startedAt = Instant.now();
        private final Map<String, Integer> runs = new LinkedHashMap<>();
        private final Map<String, Duration> time = new LinkedHashMap<>();
        private int skipped;
        private int failures;

        synchronized void nodeRan(String nodeId, Duration elapsed) {
            runs.merge(nodeId, 1, Integer::sum);
            time.merge(nodeId, elapsed, Duration::plus);
        }

        synchronized void nodeFailed() {
            failures++;
        }

        synchronized void nodeSkipped() {
            skipped++;
        }

        synchronized ExecutionStats toStats(ExecutionContext context, boolean succeeded) {
            String slowest = null;
            Duration max = Duration.ZERO;
            for (Map.Entry<String, Duration> e : time.entrySet()) {
                if (slowest == null || e.getValue().compareTo(max) > 0) {
                    slowest = e.getKey();
                    max = e.getValue();
                }
            }
            return new ExecutionStats(context.getExecutionId(), context.getWorkflowId(), succeeded,
                    Duration.between(startedAt, Instant.now()), runs, time, skipped, failures, slowest);
        }
    }
}
