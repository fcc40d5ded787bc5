package com.graphflow.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphflow.engine.merge.MergePolicy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Engine settings. Built with {@link #builder()}, read from {@code GRAPHFLOW_*} environment variables with
 * {@link #fromEnvironment()}, or parsed from JSON with {@link #fromJson(String)}.
 * <p>
 * Variables: GRAPHFLOW_MAX_STEPS, GRAPHFLOW_HISTORY_MAX_LENGTH, GRAPHFLOW_CHECKPOINT_INTERVAL,
 * GRAPHFLOW_STRICT_VALIDATION, GRAPHFLOW_MERGE_STRATEGY, GRAPHFLOW_RUN_TIMEOUT_MILLIS and
 * GRAPHFLOW_AUTO_SNAPSHOT_NODES (comma-separated node ids).
 */
public final class EngineConfig {

    private static final String ENV_MAX_STEPS = "GRAPHFLOW_MAX_STEPS";
    private static final String ENV_HISTORY_MAX_LENGTH = "GRAPHFLOW_HISTORY_MAX_LENGTH";
    private static final String ENV_CHECKPOINT_INTERVAL = "GRAPHFLOW_CHECKPOINT_INTERVAL";
    private static final String ENV_STRICT_VALIDATION = "GRAPHFLOW_STRICT_VALIDATION";
    private static final String ENV_MERGE_STRATEGY = "GRAPHFLOW_MERGE_STRATEGY";
    private static final String ENV_RUN_TIMEOUT_MILLIS = "GRAPHFLOW_RUN_TIMEOUT_MILLIS";
    private static final String ENV_AUTO_SNAPSHOT_NODES = "GRAPHFLOW_AUTO_SNAPSHOT_NODES";

    public static final int DEFAULT_MAX_STEPS = 1000;
    public static final int DEFAULT_HISTORY_MAX_LENGTH = 1000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final int maxSteps;
    private final int historyMaxLength;
    private final int checkpointInterval;
    private final boolean strictValidation;
    private final MergePolicy mergeStrategy;
    private final long runTimeoutMillis;
    private final Set<String> autoSnapshotNodes;

    private EngineConfig(Builder b) {
        if (b.maxSteps < 1) throw new IllegalArgumentException("maxSteps must be >= 1: " + b.maxSteps);
        if (b.historyMaxLength < 1) {
            throw new IllegalArgumentException("historyMaxLength must be >= 1: " + b.historyMaxLength);
        }
        this.maxSteps = b.maxSteps;
        this.historyMaxLength = b.historyMaxLength;
        this.checkpointInterval = Math.max(0, b.checkpointInterval);
        this.strictValidation = b.strictValidation;
        this.mergeStrategy = b.mergeStrategy != null ? b.mergeStrategy : MergePolicy.LAST_WRITE_WINS;
        this.runTimeoutMillis = Math.max(0L, b.runTimeoutMillis);
        this.autoSnapshotNodes = Collections.unmodifiableSet(new LinkedHashSet<>(b.autoSnapshotNodes));
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads settings from the given variables; missing or unparsable values fall back to defaults. */
    public static EngineConfig fromEnvironment(Map<String, String> env) {
        Builder b = builder();
        b.maxSteps(parseInt(env.get(ENV_MAX_STEPS), DEFAULT_MAX_STEPS));
        b.historyMaxLength(parseInt(env.get(ENV_HISTORY_MAX_LENGTH), DEFAULT_HISTORY_MAX_LENGTH));
        b.checkpointInterval(parseInt(env.get(ENV_CHECKPOINT_INTERVAL), 0));
        b.strictValidation(parseBoolean(env.get(ENV_STRICT_VALIDATION), false));
        String merge = env.get(ENV_MERGE_STRATEGY);
        try {
            b.mergeStrategy(MergePolicy.parse(merge));
        } catch (IllegalArgumentException e) {
            b.mergeStrategy(MergePolicy.LAST_WRITE_WINS);
        }
        b.runTimeoutMillis(parseLong(env.get(ENV_RUN_TIMEOUT_MILLIS), 0L));
        String nodes = env.get(ENV_AUTO_SNAPSHOT_NODES);
        if (nodes != null && !nodes.isBlank()) {
            b.autoSnapshotNodes(Arrays.stream(nodes.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList()));
        }
        return b.build();
    }

    /**
     * Parses a JSON object with the same keys as the builder, e.g.
     * {@code {"maxSteps": 50, "mergeStrategy": "FAIL_ON_CONFLICT"}}. Unknown keys are ignored.
     *
     * @throws UncheckedIOException if the JSON is malformed
     */
    public static EngineConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, Json.class).toConfig();
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid engine config JSON", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this config's values. */
    public Builder toBuilder() {
        return builder()
                .maxSteps(maxSteps)
                .historyMaxLength(historyMaxLength)
                .checkpointInterval(checkpointInterval)
                .strictValidation(strictValidation)
                .mergeStrategy(mergeStrategy)
                .runTimeoutMillis(runTimeoutMillis)
                .autoSnapshotNodes(new ArrayList<>(autoSnapshotNodes));
    }

    /** Upper bound on executed steps per run (skipped nodes count, end markers do not). */
    public int getMaxSteps() {
        return maxSteps;
    }

    /** History ring-buffer capacity. */
    public int getHistoryMaxLength() {
        return historyMaxLength;
    }

    /** Save a checkpoint every N main-path steps; 0 saves only at run end. */
    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    /** Whether unreachable nodes fail graph validation instead of producing warnings. */
    public boolean isStrictValidation() {
        return strictValidation;
    }

    public MergePolicy getMergeStrategy() {
        return mergeStrategy;
    }

    public long getRunTimeoutMillis() {
        return runTimeoutMillis;
    }

    /** Run deadline; {@link Duration#ZERO} means none. */
    public Duration getRunTimeout() {
        return Duration.ofMillis(runTimeoutMillis);
    }

    /** Node ids after which a snapshot is taken automatically (main path only). */
    public Set<String> getAutoSnapshotNodes() {
        return autoSnapshotNodes;
    }

    /** Settings exposed to nodes through {@code ExecutionContext#getConfig()}. */
    Map<String, Object> asContextConfig() {
        return Map.of(
                "maxSteps", maxSteps,
                "historyMaxLength", historyMaxLength,
                "checkpointInterval", checkpointInterval,
                "mergeStrategy", mergeStrategy.name(),
                "runTimeoutMillis", runTimeoutMillis);
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{maxSteps=" + maxSteps + ", historyMaxLength=" + historyMaxLength
                + ", checkpointInterval=" + checkpointInterval + ", strictValidation=" + strictValidation
                + ", mergeStrategy=" + mergeStrategy + ", runTimeoutMillis=" + runTimeoutMillis
                + ", autoSnapshotNodes=" + autoSnapshotNodes + "}";
    }

    public static final class Builder {
        private int maxSteps = DEFAULT_MAX_STEPS;
        private int historyMaxLength = DEFAULT_HISTORY_MAX_LENGTH;
        private int checkpointInterval;
        private boolean strictValidation;
        private MergePolicy mergeStrategy = MergePolicy.LAST_WRITE_WINS;
        private long runTimeoutMillis;
        private List<String> autoSnapshotNodes = new ArrayList<>();

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder historyMaxLength(int historyMaxLength) {
            this.historyMaxLength = historyMaxLength;
            return this;
        }

        public Builder checkpointInterval(int checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder strictValidation(boolean strictValidation) {
            this.strictValidation = strictValidation;
            return this;
        }

        public Builder mergeStrategy(MergePolicy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
            return this;
        }

        public Builder runTimeoutMillis(long runTimeoutMillis) {
            this.runTimeoutMillis = runTimeoutMillis;
            return this;
        }

        public Builder autoSnapshotNodes(List<String> autoSnapshotNodes) {
            this.autoSnapshotNodes = autoSnapshotNodes != null ? new ArrayList<>(autoSnapshotNodes) : new ArrayList<>();
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    private static final class Json {
        private final Integer maxSteps;
        private final Integer historyMaxLength;
        private final Integer checkpointInterval;
        private final Boolean strictValidation;
        private final String mergeStrategy;
        private final Long runTimeoutMillis;
        private final List<String> autoSnapshotNodes;

        @JsonCreator
        Json(@JsonProperty("maxSteps") Integer maxSteps,
             @JsonProperty("historyMaxLength") Integer historyMaxLength,
             @JsonProperty("checkpointInterval") Integer checkpointInterval,
             @JsonProperty("strictValidation") Boolean strictValidation,
             @JsonProperty("mergeStrategy") String mergeStrategy,
             @JsonProperty("runTimeoutMillis") Long runTimeoutMillis,
             @JsonProperty("autoSnapshotNodes") List<String> autoSnapshotNodes) {
            this.maxSteps = maxSteps;
            this.historyMaxLength = historyMaxLength;
            this.checkpointInterval = checkpointInterval;
            this.strictValidation = strictValidation;
            this.mergeStrategy = mergeStrategy;
            this.runTimeoutMillis = runTimeoutMillis;
            this.autoSnapshotNodes = autoSnapshotNodes;
        }

        EngineConfig toConfig() {
            Builder b = builder();
            if (maxSteps != null) b.maxSteps(maxSteps);
            if (historyMaxLength != null) b.historyMaxLength(historyMaxLength);
            if (checkpointInterval != null) b.checkpointInterval(checkpointInterval);
            if (strictValidation != null) b.strictValidation(strictValidation);
            if (mergeStrategy != null) b.mergeStrategy(MergePolicy.parse(mergeStrategy));
            if (runTimeoutMillis != null) b.runTimeoutMillis(runTimeoutMillis);
            b.autoSnapshotNodes(autoSnapshotNodes);
            return b.build();
        }
    }
}
