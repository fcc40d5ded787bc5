package com.graphflow.state.checkpoint;

import com.graphflow.state.HistoryEntry;
import com.graphflow.state.HistoryEntryKind;
import com.graphflow.state.StateDelta;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileCheckpointStoreTest {

    @TempDir
    Path dir;

    @Test
    void saveThenLoad_restoresStateHistoryAndCursor() {
        JsonFileCheckpointStore store = new JsonFileCheckpointStore(dir);
        HistoryEntry entry = new HistoryEntry(1, "fetch", Instant.parse("2026-01-01T00:00:00Z"),
                StateDelta.ofUpdates(Map.of("count", 1)), HistoryEntryKind.NODE, null);
        Checkpoint checkpoint = new Checkpoint("exec-1", "wf", 1, Map.of("count", 0), Map.of("count", 1),
                List.of(entry), List.of(new CursorEntry("next", "join")), "RUNNING", 1, null);

        store.save("exec-1", checkpoint);
        Optional<Checkpoint> loaded = store.load("exec-1");

        assertTrue(loaded.isPresent());
        assertEquals(Map.of("count", 1), loaded.get().getValues());
        assertEquals(List.of(new CursorEntry("next", "join")), loaded.get().getCursor());
        assertEquals(Map.of("count", 0), loaded.get().getInitialValues());
        assertEquals(1, loaded.get().getHistory().size());
        assertEquals("fetch", loaded.get().getHistory().get(0).getNodeId());
        assertEquals(Map.of("count", 1), loaded.get().getHistory().get(0).getDelta().getUpdates());
        assertEquals(HistoryEntryKind.NODE, loaded.get().getHistory().get(0).getKind());
    }

    @Test
    void load_missingReturnsEmpty() {
        assertTrue(new JsonFileCheckpointStore(dir).load("missing").isEmpty());
    }

    @Test
    void delete_removesFile() {
        JsonFileCheckpointStore store = new JsonFileCheckpointStore(dir);
        store.save("exec-2", new Checkpoint("exec-2", "wf", 0, Map.of(), Map.of(), List.of(), List.of(), "COMPLETED", 0, null));
        store.delete("exec-2");
        assertTrue(store.load("exec-2").isEmpty());
    }

    @Test
    void save_idsDifferingOnlyInEscapedCharactersUseSeparateFiles() {
        JsonFileCheckpointStore store = new JsonFileCheckpointStore(dir);
        store.save("a/b", new Checkpoint("a/b", "wf", 1, Map.of(), Map.of("from", "slash"), List.of(), List.of(), "RUNNING", 1, null));
        store.save("a_b", new Checkpoint("a_b", "wf", 1, Map.of(), Map.of("from", "underscore"), List.of(), List.of(), "RUNNING", 1, null));

        assertEquals("slash", store.load("a/b").orElseThrow().getValues().get("from"));
        assertEquals("underscore", store.load("a_b").orElseThrow().getValues().get("from"));
        assertNotEquals(JsonFileCheckpointStore.fileName("a/b"), JsonFileCheckpointStore.fileName("a_b"));
        assertEquals("exec-1.2", JsonFileCheckpointStore.fileName("exec-1.2"));
    }

    @Test
    void save_failedMoveLeavesNoTempFile() throws IOException {
        JsonFileCheckpointStore store = new JsonFileCheckpointStore(dir);
        Path blocked = dir.resolve("exec-3.json");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("occupied"), "x");

        assertThrows(UncheckedIOException.class, () -> store.save("exec-3",
                new Checkpoint("exec-3", "wf", 0, Map.of(), Map.of(), List.of(), List.of(), "RUNNING", 0, null)));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(blocked), files.collect(Collectors.toList()));
        }
    }
}
