package com.graphflow.hooks.builtin;

import com.graphflow.annotations.GraphHook;
import com.graphflow.annotations.HookPhase;
import com.graphflow.hooks.NodeHookContext;
import com.graphflow.hooks.RunPlugin;
import com.graphflow.hooks.Trigger;
import com.graphflow.node.ExecutionContext;
import com.graphflow.state.StateContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vetoes a node once it has run {@code maxVisits} times in the same run. The vetoed node is recorded as
 * skipped and routing continues from it, so loop guards on its edges see the unchanged state.
 * Counters are kept per execution and dropped when the run ends.
 */
@GraphHook(name = "dead-loop-guard", phase = HookPhase.BEFORE_NODE)
public final class DeadLoopGuardTrigger implements Trigger, RunPlugin {

    private static final Logger log = LoggerFactory.getLogger(DeadLoopGuardTrigger.class);

    public static final int DEFAULT_MAX_VISITS = 20;

    private final int maxVisits;
    private final Map<String, Map<String, Integer>> visitsByExecution = new ConcurrentHashMap<>();

    public DeadLoopGuardTrigger() {
        this(DEFAULT_MAX_VISITS);
    }

    public DeadLoopGuardTrigger(int maxVisits) {
        if (maxVisits < 1) throw new IllegalArgumentException("maxVisits must be >= 1");
        this.maxVisits = maxVisits;
    }

    public int getMaxVisits() {
        return maxVisits;
    }

    @Override
    public boolean before(NodeHookContext context) {
        Map<String, Integer> visits = visitsByExecution.computeIfAbsent(context.getExecutionId(),
                k -> new ConcurrentHashMap<>());
        int count = visits.merge(context.getNodeId(), 1, Integer::sum);
        if (count > maxVisits) {
            log.warn("Dead loop suspected; skipping node | executionId={} | nodeId={} | visits={} | max={}",
                    context.getExecutionId(), context.getNodeId(), count - 1, maxVisits);
            return false;
        }
        return true;
    }

    /** Visits of the node so far in the execution (including a vetoed attempt). */
    public int visits(String executionId, String nodeId) {
        Map<String, Integer> visits = visitsByExecution.get(executionId);
        return visits != null ? visits.getOrDefault(nodeId, 0) : 0;
    }

    @Override
    public void onRunEnd(ExecutionContext context, StateContainer finalState) {
        visitsByExecution.remove(context.getExecutionId());
    }

    @Override
    public void onError(ExecutionContext context, Throwable error) {
        visitsByExecution.remove(context.getExecutionId());
    }
}
