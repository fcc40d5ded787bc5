package com.graphflow.node;

import com.graphflow.state.StateContainer;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeImplementationTest {

    private final ExecutionContext ctx = new ExecutionContext("wf", "exec-1", Map.of(), null);

    @Test
    void syncNode_hasNoAsyncEntryPoint() {
        SyncNode node = (state, c) -> NodeExecutionResult.of(state.put("x", 1));
        assertEquals(ExecutionCapability.SYNC, node.capability());
        assertEquals(1, node.runSync(StateContainer.empty(), ctx).getState().get("x"));
        assertThrows(UnsupportedOperationException.class, () -> node.runAsync(StateContainer.empty(), ctx));
    }

    @Test
    void asyncNode_hasNoSyncEntryPoint() {
        AsyncNode node = (state, c) -> CompletableFuture.completedFuture(NodeExecutionResult.of(state));
        assertEquals(ExecutionCapability.ASYNC, node.capability());
        assertThrows(UnsupportedOperationException.class, () -> node.runSync(StateContainer.empty(), ctx));
    }

    @Test
    void capability_flags() {
        assertTrue(ExecutionCapability.BOTH.supportsSync());
        assertTrue(ExecutionCapability.BOTH.supportsAsync());
        assertFalse(ExecutionCapability.SYNC.supportsAsync());
        assertFalse(ExecutionCapability.ASYNC.supportsSync());
        assertEquals(ExecutionCapability.ASYNC, ExecutionCapability.parse(" async "));
    }

    @Test
    void result_goToAndFailure() {
        StateContainer state = StateContainer.empty();
        NodeExecutionResult next = NodeExecutionResult.goTo(state, "a", "b");
        assertEquals(java.util.List.of("a", "b"), next.getExplicitNext().orElseThrow());
        assertTrue(next.isSuccess());

        NodeExecutionResult failed = NodeExecutionResult.failed(state, ErrorInfo.nonRetryable("Bad", "nope"));
        assertFalse(failed.isSuccess());
        assertFalse(failed.getError().orElseThrow().isRetryable());
    }
}
