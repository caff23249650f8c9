package com.quillmind.core.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity, insertion-ordered history. Appending beyond capacity evicts the
 * oldest entry first.
 * <p>
 * Not thread-safe on its own; owners guard it together with the metrics that read it.
 *
 * @param <T> entry type
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 256));
    }

    public void append(T entry) {
        entries.addLast(entry);
        if (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public Optional<T> latest() {
        return Optional.ofNullable(entries.peekLast());
    }

    /** The entry before the latest one, if any. */
    public Optional<T> previous() {
        if (entries.size() < 2) {
            return Optional.empty();
        }
        var it = entries.descendingIterator();
        it.next();
        return Optional.of(it.next());
    }

    /** Up to {@code n} most recent entries, oldest first. */
    public List<T> recent(int n) {
        var all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public List<T> snapshot() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
