package br.edu.ifba.wikicorpus.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DedupCacheTest {

    @Test
    void testRemembersIdsPerKind() {
        DedupCache cache = new DedupCache();
        cache.putCategory("Physics", 1L);
        cache.putImage("abc", 1L);

        assertEquals(1L, cache.categoryId("Physics"));
        assertEquals(1L, cache.imageId("abc"));
        assertNull(cache.categoryId("abc"));
    }

    @Test
    void testEvictsLeastRecentlyUsed() {
        DedupCache cache = new DedupCache(2);
        cache.putCategory("a", 1L);
        cache.putCategory("b", 2L);
        cache.categoryId("a");
        cache.putCategory("c", 3L);

        assertEquals(2, cache.categoryCount());
        assertEquals(1L, cache.categoryId("a"));
        assertNull(cache.categoryId("b"));
    }

    @Test
    void testClearForgetsEverything() {
        DedupCache cache = new DedupCache();
        cache.putCategory("a", 1L);
        cache.putImage("h", 2L);

        cache.clear();

        assertEquals(0, cache.categoryCount());
        assertEquals(0, cache.imageCount());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(0));
    }
}
