package com.graphflow.graph.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code <workflowId>.json} from a directory.
 */
public final class DirectoryConfigSource implements ConfigSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryConfigSource.class);

    private final Path directory;

    public DirectoryConfigSource(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Optional<String> getDescriptorJson(String workflowId) {
        if (workflowId == null || workflowId.isBlank() || workflowId.contains("/") || workflowId.contains("\\")
                || workflowId.contains("..")) {
            log.warn("Rejected workflow id for directory lookup | workflowId={}", workflowId);
            return Optional.empty();
        }
        Path file = directory.resolve(workflowId + ".json");
        if (!Files.isRegularFile(file)) {
            log.debug("No descriptor file | workflowId={} | path={}", workflowId, file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
