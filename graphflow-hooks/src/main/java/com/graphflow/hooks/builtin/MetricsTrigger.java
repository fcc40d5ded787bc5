package com.graphflow.hooks.builtin;

import com.graphflow.annotations.GraphHook;
import com.graphflow.annotations.HookPhase;
import com.graphflow.hooks.NodeHookContext;
import com.graphflow.hooks.Trigger;
import com.graphflow.node.NodeExecutionResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records {@code graphflow.node.executions} (counter by workflow, node type and outcome) and
 * {@code graphflow.node.duration} (timer by workflow and node type).
 * Without an injected registry, a {@link SimpleMeterRegistry} is created on first use (CAS, at most one per trigger).
 */
@GraphHook(name = "metrics", phase = HookPhase.AROUND_NODE, applicableNodeTypes = { "*" })
public final class MetricsTrigger implements Trigger {

    public static final String EXECUTIONS = "graphflow.node.executions";
    public static final String DURATION = "graphflow.node.duration";

    private final AtomicReference<MeterRegistry> registry = new AtomicReference<>();

    public MetricsTrigger() {
    }

    public MetricsTrigger(MeterRegistry meterRegistry) {
        registry.set(meterRegistry);
    }

    public MeterRegistry getRegistry() {
        MeterRegistry existing = registry.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (registry.compareAndSet(null, created)) {
            return created;
        }
        return registry.get();
    }

    @Override
    public void after(NodeHookContext context, NodeExecutionResult result) {
        record(context, "success");
    }

    @Override
    public void onNodeError(NodeHookContext context, Throwable error) {
        record(context, "error");
    }

    private void record(NodeHookContext context, String outcome) {
        MeterRegistry meters = getRegistry();
        String workflow = nullToUnknown(context.getExecutionContext().getWorkflowId());
        String nodeType = nullToUnknown(context.getNodeType());
        meters.counter(EXECUTIONS, "workflow", workflow, "nodeType", nodeType, "outcome", outcome).increment();
        Timer.builder(DURATION)
                .tag("workflow", workflow)
                .tag("nodeType", nodeType)
                .register(meters)
                .record(context.getElapsed().toNanos(), TimeUnit.NANOSECONDS);
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
