package com.ripple.resilience.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity FIFO buffer; appending to a full buffer evicts the oldest entry.
 * Safe for concurrent writers.
 *
 * @param <T> entry type
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void add(T entry) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    public synchronized void addAll(Collection<? extends T> batch) {
        batch.forEach(this::add);
    }

    /**
     * Returns up to {@code limit} most recent entries, oldest first. A limit of zero or less
     * returns everything.
     */
    public synchronized List<T> latest(int limit) {
        List<T> all = new ArrayList<>(entries);
        if (limit <= 0 || limit >= all.size()) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - limit, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }
}
