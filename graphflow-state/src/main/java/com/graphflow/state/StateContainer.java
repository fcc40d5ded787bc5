package com.graphflow.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable state passed between nodes of one run. Values are copy-on-write: every mutation swaps in a
 * new unmodifiable map and increments {@link #getRevision()}, so maps previously returned by
 * {@link #values()} never change. Metadata is run bookkeeping and does not affect the revision.
 * <p>
 * Owned by a single run. Use {@link #copy()} to hand state to another run or branch.
 */
public final class StateContainer {

    private Map<String, Object> values;
    private long revision;
    private final Map<String, Object> metadata;

    public StateContainer() {
        this(Map.of(), 0L, Map.of());
    }

    public StateContainer(Map<String, ?> values, long revision, Map<String, ?> metadata) {
        this.values = Collections.unmodifiableMap(DeepCopy.copyMap(values));
        this.revision = revision;
        this.metadata = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
    }

    /** New container at revision 0 holding a deep copy of the given values. */
    public static StateContainer of(Map<String, ?> values) {
        return new StateContainer(values, 0L, Map.of());
    }

    public static StateContainer empty() {
        return new StateContainer();
    }

    /** Current values. Unmodifiable and stable: later mutations do not affect the returned map. */
    public synchronized Map<String, Object> values() {
        return values;
    }

    public synchronized long getRevision() {
        return revision;
    }

    public synchronized Object get(String key) {
        return values.get(key);
    }

    public synchronized Object getOrDefault(String key, Object defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    @SuppressWarnings("unchecked")
    public synchronized <T> T get(String key, Class<T> type) {
        Object v = values.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }

    public synchronized boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public synchronized StateContainer put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(key, value);
        swap(next);
        return this;
    }

    public synchronized StateContainer putAll(Map<String, ?> updates) {
        if (updates == null || updates.isEmpty()) return this;
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.putAll(updates);
        swap(next);
        return this;
    }

    public synchronized StateContainer remove(String key) {
        if (!values.containsKey(key)) return this;
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.remove(key);
        swap(next);
        return this;
    }

    /**
     * Commits a delta as one logical mutation. The revision always advances, even for an empty delta,
     * so that each committed step has its own revision.
     *
     * @return the new revision
     */
    public synchronized long commit(StateDelta delta) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        if (delta != null) delta.applyTo(next);
        swap(next);
        return revision;
    }

    /**
     * Replaces all values (e.g. on snapshot restore) as one logical mutation.
     *
     * @return the new revision
     */
    public synchronized long replaceValues(Map<String, ?> newValues) {
        swap(DeepCopy.copyMap(newValues));
        return revision;
    }

    public synchronized Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public synchronized StateContainer putMetadata(String key, Object value) {
        metadata.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    /** Deep copy: same revision, independent values and metadata. */
    public synchronized StateContainer copy() {
        return new StateContainer(values, revision, DeepCopy.copyMap(metadata));
    }

    private void swap(Map<String, Object> next) {
        this.values = Collections.unmodifiableMap(next);
        this.revision++;
    }

    @Override
    public synchronized String toString() {
        return "StateContainer{revision=" + revision + ", values=" + values + "}";
    }
}
