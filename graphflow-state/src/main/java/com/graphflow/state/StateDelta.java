package com.graphflow.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Change set between two versions of state values: keys written (with their new values) and keys removed.
 * A key is never both updated and removed. Immutable.
 */
public final class StateDelta {

    private static final StateDelta EMPTY = new StateDelta(Map.of(), List.of());

    private final Map<String, Object> updates;
    private final List<String> removed;

    @JsonCreator
    public StateDelta(
            @JsonProperty("updates") Map<String, Object> updates,
            @JsonProperty("removed") List<String> removed) {
        Map<String, Object> u = new LinkedHashMap<>();
        if (updates != null) u.putAll(updates);
        Set<String> r = new LinkedHashSet<>();
        if (removed != null) {
            for (String key : removed) {
                if (!u.containsKey(key)) r.add(key);
            }
        }
        this.updates = Collections.unmodifiableMap(u);
        this.removed = List.copyOf(r);
    }

    public static StateDelta empty() {
        return EMPTY;
    }

    public static StateDelta ofUpdates(Map<String, Object> updates) {
        return new StateDelta(updates, null);
    }

    public static StateDelta ofRemoval(String key) {
        return new StateDelta(null, List.of(key));
    }

    /** Keys written and their new values (values may be null). Unmodifiable. */
    public Map<String, Object> getUpdates() {
        return updates;
    }

    /** Keys removed. */
    public List<String> getRemoved() {
        return removed;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return updates.isEmpty() && removed.isEmpty();
    }

    /** Keys touched by this delta (updated or removed). */
    public Set<String> touchedKeys() {
        Set<String> keys = new LinkedHashSet<>(updates.keySet());
        keys.addAll(removed);
        return keys;
    }

    /** Applies this delta in place to the given map (values are deep-copied). */
    public void applyTo(Map<String, Object> target) {
        for (Map.Entry<String, Object> e : updates.entrySet()) {
            target.put(e.getKey(), DeepCopy.copyValue(e.getValue()));
        }
        for (String key : removed) {
            target.remove(key);
        }
    }

    /** Returns a delta equivalent to applying this delta followed by {@code next}. */
    public StateDelta then(StateDelta next) {
        if (next == null || next.isEmpty()) return this;
        if (isEmpty()) return next;
        Map<String, Object> u = new LinkedHashMap<>(updates);
        List<String> r = new ArrayList<>(removed);
        for (Map.Entry<String, Object> e : next.updates.entrySet()) {
            r.remove(e.getKey());
            u.put(e.getKey(), e.getValue());
        }
        for (String key : next.removed) {
            u.remove(key);
            if (!r.contains(key)) r.add(key);
        }
        return new StateDelta(u, r);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateDelta that = (StateDelta) o;
        return updates.equals(that.updates) && removed.equals(that.removed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(updates, removed);
    }

    @Override
    public String toString() {
        return "StateDelta{updates=" + updates.keySet() + ", removed=" + removed + "}";
    }
}
