package com.lsnp.peer.transport;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * Bounded set of recently seen message ids with FIFO eviction.
 */
public class DedupCache {

    public static final int DEFAULT_CAPACITY = 4096;

    private final int capacity;
    private final Set<String> seen = new HashSet<>();
    private final ArrayDeque<String> order = new ArrayDeque<>();

    public DedupCache() {
        this(DEFAULT_CAPACITY);
    }

    public DedupCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Check-and-record. Returns true if {@code messageId} was already seen;
     * otherwise records it, evicting the oldest id when full, and returns false.
     */
    public synchronized boolean isDuplicate(String messageId) {
        if (seen.contains(messageId)) {
            return true;
        }
        seen.add(messageId);
        order.addLast(messageId);
        while (order.size() > capacity) {
            seen.remove(order.removeFirst());
        }
        return false;
    }

    public synchronized boolean contains(String messageId) {
        return seen.contains(messageId);
    }

    public synchronized int size() {
        return order.size();
    }

    public int capacity() {
        return capacity;
    }
}
