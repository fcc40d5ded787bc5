package com.graphflow.state;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of committed deltas, bounded as a ring buffer: once {@code maxLength} entries are held,
 * each append evicts the oldest entry. Entries are never modified.
 */
public final class History {

    /** Default retention when none is configured. */
    public static final int DEFAULT_MAX_LENGTH = 1000;

    private final int maxLength;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();
    private long droppedCount;

    public History() {
        this(DEFAULT_MAX_LENGTH);
    }

    /**
     * @param maxLength maximum retained entries; values below 1 are treated as 1
     */
    public History(int maxLength) {
        this.maxLength = Math.max(1, maxLength);
    }

    public synchronized void append(HistoryEntry entry) {
        if (entries.size() == maxLength) {
            entries.removeFirst();
            droppedCount++;
        }
        entries.addLast(entry);
    }

    public synchronized void appendAll(List<HistoryEntry> toAppend) {
        for (HistoryEntry e : toAppend) append(e);
    }

    /** Retained entries, oldest first. */
    public synchronized List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxLength() {
        return maxLength;
    }

    /** Number of entries evicted by the retention policy. */
    public synchronized long getDroppedCount() {
        return droppedCount;
    }

    public synchronized HistoryEntry last() {
        return entries.peekLast();
    }

    /**
     * Replays all entries in order on top of {@code initialValues}.
     *
     * @throws IllegalStateException if entries were evicted, since replay would be incomplete
     */
    public synchronized Map<String, Object> replay(Map<String, ?> initialValues) {
        if (droppedCount > 0) {
            throw new IllegalStateException("History has evicted " + droppedCount
                    + " entries (maxLength=" + maxLength + "); replay from the initial state is not possible");
        }
        Map<String, Object> values = new LinkedHashMap<>(DeepCopy.copyMap(initialValues));
        for (HistoryEntry e : entries) {
            e.getDelta().applyTo(values);
        }
        return values;
    }
}
