package com.graphflow.state.checkpoint;

import com.graphflow.state.StateJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * CheckpointStore writing one JSON file per execution ({@code <executionId>.json}) under a directory.
 * Writes go to a temp file first and are moved into place, so a reader never sees a partial file;
 * a failed write removes its temp file.
 */
public final class JsonFileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCheckpointStore.class);

    private final Path directory;

    public JsonFileCheckpointStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public void save(String executionId, Checkpoint checkpoint) {
        Path target = fileFor(executionId);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, fileName(executionId), ".tmp");
            Files.writeString(tmp, StateJson.toJson(checkpoint), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            tmp = null;
            log.debug("Checkpoint saved | executionId={} | file={}", executionId, target);
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("Failed to write checkpoint " + target, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    @Override
    public Optional<Checkpoint> load(String executionId) {
        Path file = fileFor(executionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(StateJson.fromJson(Files.readString(file, StandardCharsets.UTF_8), Checkpoint.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, e);
        }
    }

    @Override
    public void delete(String executionId) {
        try {
            Files.deleteIfExists(fileFor(executionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoint for " + executionId, e);
        }
    }

    private Path fileFor(String executionId) {
        return directory.resolve(fileName(executionId) + ".json");
    }

    /**
     * Injective file name for an execution id: letters, digits, '.' and '-' are kept and every other
     * character becomes {@code _} plus its four hex digits, so distinct ids never share a file.
     */
    static String fileName(String executionId) {
        StringBuilder out = new StringBuilder(executionId.length());
        for (int i = 0; i < executionId.length(); i++) {
            char c = executionId.charAt(i);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '-') {
                out.append(c);
            } else {
                out.append('_').append(String.format("%04x", (int) c));
            }
        }
        return out.toString();
    }
}
