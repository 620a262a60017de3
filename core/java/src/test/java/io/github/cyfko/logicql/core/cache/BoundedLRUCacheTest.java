package io.github.cyfko.logicql.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedLRUCache Tests")
class BoundedLRUCacheTest {

    @Test
    @DisplayName("Least recently used entry is evicted")
    void testEviction() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(2);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");
        cache.put("c", 3);

        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("computeIfAbsent computes once")
    void testComputeOnce() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);
        AtomicInteger calls = new AtomicInteger();

        int first = cache.computeIfAbsent("abc", k -> { calls.incrementAndGet(); return k.length(); });
        int second = cache.computeIfAbsent("abc", k -> { calls.incrementAndGet(); return -1; });

        assertEquals(3, first);
        assertEquals(3, second);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Exceptions from the mapping function propagate and leave the cache unchanged")
    void testComputeFailure() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);

        assertThrows(IllegalStateException.class,
                () -> cache.computeIfAbsent("x", k -> { throw new IllegalStateException("boom"); }));
        assertEquals(0, cache.size());
        assertEquals(Integer.valueOf(7), cache.computeIfAbsent("x", k -> 7));
    }

    @Test
    @DisplayName("Clear, stats and invalid size")
    void testMisc() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(4);
        cache.put("a", 1);
        assertTrue(cache.getStats().startsWith("BoundedLRUCache[size=1, maxSize=4, utilization="));
        cache.clear();
        assertNull(cache.get("a"));
        assertEquals(4, cache.getMaxSize());

        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<>(0));
    }
}
