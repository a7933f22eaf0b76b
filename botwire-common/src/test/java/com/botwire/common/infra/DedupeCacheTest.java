package com.botwire.common.infra;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DedupeCacheTest {

    private final AtomicLong now = new AtomicLong(1000);

    @Nested
    class BasicBehavior {
        @Test
        void firstCheck_returnsFalse() {
            var cache = new DedupeCache(60_000, 100, now::get);
            assertFalse(cache.isDuplicate("update:1"));
        }

        @Test
        void secondCheck_withinTtl_returnsTrue() {
            var cache = new DedupeCache(60_000, 100, now::get);
            assertFalse(cache.isDuplicate("update:1"));
            now.set(2000);
            assertTrue(cache.isDuplicate("update:1"));
        }

        @Test
        void afterTtlExpiry_returnsFalse() {
            var cache = new DedupeCache(5_000, 100, now::get);
            assertFalse(cache.isDuplicate("update:1"));
            now.set(7000);
            assertFalse(cache.isDuplicate("update:1"));
        }

        @Test
        void nullOrEmptyKey_returnsFalse() {
            var cache = new DedupeCache(60_000, 100, now::get);
            assertFalse(cache.isDuplicate(null));
            assertFalse(cache.isDuplicate(""));
            assertEquals(0, cache.size());
        }
    }

    @Nested
    class MaxSize {
        @Test
        void evictsOldestWhenFull() {
            var cache = new DedupeCache(60_000, 3, now::get);
            cache.isDuplicate("a");
            cache.isDuplicate("b");
            cache.isDuplicate("c");
            cache.isDuplicate("d");
            assertEquals(3, cache.size());
            assertFalse(cache.isDuplicate("a"));
            assertTrue(cache.isDuplicate("d"));
        }
    }

    @Test
    void clear_emptiesCache() {
        var cache = new DedupeCache(60_000, 100, now::get);
        cache.isDuplicate("a");
        cache.isDuplicate("b");
        assertEquals(2, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }
}
