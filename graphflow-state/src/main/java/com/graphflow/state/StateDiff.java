package com.graphflow.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes deltas between two versions of state values and renders them for diagnostics.
 */
public final class StateDiff {

    private StateDiff() {
    }

    /**
     * Returns the delta that turns {@code before} into {@code after}: keys added or changed are updates,
     * keys missing from {@code after} are removals.
     */
    public static StateDelta between(Map<String, ?> before, Map<String, ?> after) {
        Map<String, ?> b = before != null ? before : Map.of();
        Map<String, ?> a = after != null ? after : Map.of();
        Map<String, Object> updates = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : a.entrySet()) {
            String key = e.getKey();
            if (!b.containsKey(key) || !Objects.deepEquals(b.get(key), e.getValue())) {
                updates.put(key, DeepCopy.copyValue(e.getValue()));
            }
        }
        List<String> removed = new ArrayList<>();
        for (String key : b.keySet()) {
            if (!a.containsKey(key)) removed.add(key);
        }
        return new StateDelta(updates, removed);
    }

    /**
     * Human-readable description of the changes between two versions, one line per key:
     * {@code + key=value} (added), {@code ~ key: old -> new} (changed), {@code - key} (removed).
     */
    public static List<String> describe(Map<String, ?> before, Map<String, ?> after) {
        Map<String, ?> b = before != null ? before : Map.of();
        StateDelta delta = between(before, after);
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Object> e : delta.getUpdates().entrySet()) {
            if (b.containsKey(e.getKey())) {
                lines.add("~ " + e.getKey() + ": " + b.get(e.getKey()) + " -> " + e.getValue());
            } else {
                lines.add("+ " + e.getKey() + "=" + e.getValue());
            }
        }
        for (String key : delta.getRemoved()) {
            lines.add("- " + key);
        }
        return lines;
    }
}
