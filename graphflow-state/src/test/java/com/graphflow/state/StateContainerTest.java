package com.graphflow.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateContainerTest {

    @Test
    void put_advancesRevisionAndLeavesEarlierViewsUnchanged() {
        StateContainer state = StateContainer.of(Map.of("count", 0));
        Map<String, Object> before = state.values();

        state.put("count", 1);

        assertEquals(1L, state.getRevision());
        assertEquals(0, before.get("count"));
        assertEquals(1, state.get("count"));
    }

    @Test
    void values_isUnmodifiable() {
        StateContainer state = StateContainer.of(Map.of("a", 1));
        assertThrows(UnsupportedOperationException.class, () -> state.values().put("b", 2));
    }

    @Test
    void commit_emptyDeltaStillAdvancesRevision() {
        StateContainer state = StateContainer.empty();
        long rev = state.commit(StateDelta.empty());
        assertEquals(1L, rev);
        assertTrue(state.values().isEmpty());
    }

    @Test
    void commit_appliesUpdatesAndRemovals() {
        StateContainer state = StateContainer.of(Map.of("a", 1, "b", 2));
        state.commit(new StateDelta(Map.of("c", 3), List.of("a")));

        assertFalse(state.containsKey("a"));
        assertEquals(2, state.get("b"));
        assertEquals(3, state.get("c"));
    }

    @Test
    void copy_isDeepAndKeepsRevision() {
        List<Object> items = new ArrayList<>(List.of("x"));
        StateContainer state = StateContainer.of(Map.of("items", items));
        state.put("n", 1);

        StateContainer copy = state.copy();
        @SuppressWarnings("unchecked")
        List<Object> copiedItems = (List<Object>) copy.get("items");
        copiedItems.add("y");

        assertEquals(state.getRevision(), copy.getRevision());
        assertNotSame(state.get("items"), copy.get("items"));
        assertEquals(List.of("x"), state.get("items"));
    }

    @Test
    void of_copiesInputSoCallerMutationsDoNotLeak() {
        List<Object> items = new ArrayList<>(List.of("x"));
        StateContainer state = StateContainer.of(Map.of("items", items));
        items.add("y");
        assertEquals(List.of("x"), state.get("items"));
    }

    @Test
    void get_typedReturnsNullOnTypeMismatch() {
        StateContainer state = StateContainer.of(Map.of("n", 5));
        assertEquals(5, state.get("n", Integer.class));
        assertNull(state.get("n", String.class));
    }

    @Test
    void metadata_doesNotAffectRevision() {
        StateContainer state = StateContainer.empty();
        state.putMetadata("source", "test");
        assertEquals(0L, state.getRevision());
        assertEquals("test", state.getMetadata().get("source"));
    }
}
