package com.graphflow.state;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HistoryTest {

    @Test
    void append_evictsOldestWhenFull() {
        History history = new History(2);
        history.append(HistoryEntry.node(1, "a", StateDelta.empty()));
        history.append(HistoryEntry.node(2, "b", StateDelta.empty()));
        history.append(HistoryEntry.node(3, "c", StateDelta.empty()));

        List<HistoryEntry> entries = history.entries();
        assertEquals(2, entries.size());
        assertEquals("b", entries.get(0).getNodeId());
        assertEquals("c", entries.get(1).getNodeId());
        assertEquals(1L, history.getDroppedCount());
    }

    @Test
    void replay_reconstructsValuesFromInitialState() {
        History history = new History();
        history.append(HistoryEntry.node(1, "a", StateDelta.ofUpdates(Map.of("count", 1, "tmp", "x"))));
        history.append(HistoryEntry.node(2, "b", new StateDelta(Map.of("count", 2), List.of("tmp"))));

        Map<String, Object> replayed = history.replay(Map.of("count", 0));

        assertEquals(Map.of("count", 2), replayed);
    }

    @Test
    void replay_afterEvictionIsRejected() {
        History history = new History(1);
        history.append(HistoryEntry.node(1, "a", StateDelta.empty()));
        history.append(HistoryEntry.node(2, "b", StateDelta.empty()));

        assertThrows(IllegalStateException.class, () -> history.replay(Map.of()));
    }
}
