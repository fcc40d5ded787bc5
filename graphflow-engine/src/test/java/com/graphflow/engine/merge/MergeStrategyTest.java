package com.graphflow.engine.merge;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MergeStrategyTest {

    private static final Map<String, Object> BASE = Map.of("shared", "base", "keep", 1, "drop", true);

    private static BranchOutcome branch(String id, Map<String, Object> values) {
        return BranchOutcome.of(id, BASE, values);
    }

    private static Map<String, Object> with(Map<String, Object> base, Object... kv) {
        Map<String, Object> values = new HashMap<>(base);
        for (int i = 0; i < kv.length; i += 2) {
            values.put((String) kv[i], kv[i + 1]);
        }
        return values;
    }

    @Test
    void branchOutcome_recordsOnlyChanges() {
        BranchOutcome outcome = branch("G", with(BASE, "g", 1));

        assertEquals(Map.of("g", 1), outcome.getChanges().getUpdates());
        assertEquals("G", outcome.getBranchId());
    }

    @Test
    void lastWriteWins_laterBranchWinsAndDisjointKeysSurvive() {
        Map<String, Object> merged = new LastWriteWinsMerge().merge(BASE, List.of(
                branch("G", with(BASE, "shared", "G", "g", 1)),
                branch("H", with(BASE, "shared", "H", "h", 2))));

        assertEquals(Map.of("shared", "H", "keep", 1, "drop", true, "g", 1, "h", 2), merged);
    }

    @Test
    void lastWriteWins_removalInBranchIsApplied() {
        Map<String, Object> withoutDrop = new HashMap<>(BASE);
        withoutDrop.remove("drop");

        Map<String, Object> merged = new LastWriteWinsMerge().merge(BASE, List.of(branch("G", withoutDrop)));

        assertEquals(Map.of("shared", "base", "keep", 1), merged);
    }

    @Test
    void failOnConflict_differentWritesConflict() {
        Map<String, Object> withoutKeep = new HashMap<>(BASE);
        withoutKeep.remove("keep");

        MergeConflictException e = assertThrows(MergeConflictException.class, () -> new FailOnConflictMerge()
                .merge(BASE, List.of(
                        branch("G", with(BASE, "shared", "G", "keep", 2)),
                        branch("H", with(withoutKeep, "shared", "H")))));

        assertEquals(Set.of("keep", "shared"), e.getConflictingKeys());
    }

    @Test
    void failOnConflict_identicalWritesMerge() {
        Map<String, Object> merged = new FailOnConflictMerge().merge(BASE, List.of(
                branch("G", with(BASE, "shared", "same", "g", 1)),
                branch("H", with(BASE, "shared", "same"))));

        assertEquals("same", merged.get("shared"));
        assertEquals(1, merged.get("g"));
    }

    @Test
    void mergePolicy_parse() {
        assertEquals(MergePolicy.FAIL_ON_CONFLICT, MergePolicy.parse(" fail-on-conflict "));
        assertEquals(MergePolicy.LAST_WRITE_WINS, MergePolicy.parse(null));
        assertEquals(MergePolicy.LAST_WRITE_WINS, MergePolicy.parse(""));
        assertThrows(IllegalArgumentException.class, () -> MergePolicy.parse("random"));
        assertInstanceOf(FailOnConflictMerge.class, MergePolicy.FAIL_ON_CONFLICT.strategy());
        assertEquals("LAST_WRITE_WINS", MergePolicy.LAST_WRITE_WINS.strategy().name());
    }
}
