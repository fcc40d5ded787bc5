package com.graphflow.engine.merge;

import java.util.Locale;

/**
 * Built-in merge strategies selectable by configuration.
 */
public enum MergePolicy {
    LAST_WRITE_WINS,
    FAIL_ON_CONFLICT;

    public MergeStrategy strategy() {
        return this == FAIL_ON_CONFLICT ? new FailOnConflictMerge() : new LastWriteWinsMerge();
    }

    /** Case-insensitive; dashes are accepted for underscores. Blank gives the default. */
    public static MergePolicy parse(String value) {
        if (value == null || value.isBlank()) return LAST_WRITE_WINS;
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
