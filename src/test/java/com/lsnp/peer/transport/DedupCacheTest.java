package com.lsnp.peer.transport;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DedupCacheTest {

    @Test
    void firstSightingIsNotDuplicate() {
        DedupCache cache = new DedupCache();
        assertFalse(cache.isDuplicate("m1"));
        assertTrue(cache.isDuplicate("m1"));
        assertTrue(cache.isDuplicate("m1"));
        assertEquals(1, cache.size());
    }

    @Test
    void evictsOldestWhenFull() {
        DedupCache cache = new DedupCache(3);
        cache.isDuplicate("a");
        cache.isDuplicate("b");
        cache.isDuplicate("c");
        cache.isDuplicate("d");

        assertEquals(3, cache.size());
        assertFalse(cache.contains("a"));
        assertTrue(cache.contains("b"));
        assertTrue(cache.contains("d"));
        assertFalse(cache.isDuplicate("a"), "evicted id is treated as new");
    }

    @Test
    void duplicateCheckDoesNotRefreshPosition() {
        DedupCache cache = new DedupCache(2);
        cache.isDuplicate("a");
        cache.isDuplicate("b");
        assertTrue(cache.isDuplicate("a"));
        cache.isDuplicate("c");
        assertFalse(cache.contains("a"));
    }

    @Test
    void defaultCapacity() {
        assertEquals(4096, new DedupCache().capacity());
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(0));
    }
}
