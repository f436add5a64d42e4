package com.jreinhal.waypoint.cache;

import com.jreinhal.waypoint.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpiringCacheTest {

    private MutableClock clock;
    private ExpiringCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new ExpiringCache<>("test", Duration.ofMinutes(10), 3, clock);
    }

    @Nested
    @DisplayName("Reads and writes")
    class ReadsAndWrites {

        @Test
        @DisplayName("get returns the value just set")
        void getReturnsValueJustSet() {
            cache.set("k", "v");
            assertEquals("v", cache.get("k").orElseThrow());
        }

        @Test
        @DisplayName("get on an unknown key is a miss")
        void unknownKeyIsMiss() {
            assertTrue(cache.get("missing").isEmpty());
        }

        @Test
        @DisplayName("set replaces the previous value")
        void setReplacesValue() {
            cache.set("k", "v1");
            cache.set("k", "v2");
            assertEquals("v2", cache.get("k").orElseThrow());
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("clear(key) removes only that key")
        void clearSingleKey() {
            cache.set("a", "1");
            cache.set("b", "2");
            cache.clear("a");
            assertTrue(cache.get("a").isEmpty());
            assertEquals("2", cache.get("b").orElseThrow());
        }

        @Test
        @DisplayName("clear() empties the cache")
        void clearAll() {
            cache.set("a", "1");
            cache.set("b", "2");
            cache.clear();
            assertEquals(0, cache.size());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Entry is a miss once the TTL has elapsed")
        void expiresAfterTtl() {
            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(9));
            assertTrue(cache.get("k").isPresent());
            clock.advance(Duration.ofMinutes(1));
            assertTrue(cache.get("k").isEmpty());
            assertEquals(0, cache.size(), "expired entry should be deleted on read");
        }

        @Test
        @DisplayName("computeIfPresent keeps the original insertion time")
        void computeDoesNotExtendTtl() {
            cache.set("k", "v1");
            clock.advance(Duration.ofMinutes(8));
            assertEquals("v1+", cache.computeIfPresent("k", v -> v + "+").orElseThrow());
            assertEquals("v1+", cache.get("k").orElseThrow());
            clock.advance(Duration.ofMinutes(2));
            assertTrue(cache.get("k").isEmpty());
        }

        @Test
        @DisplayName("computeIfPresent on an absent or expired key does nothing")
        void computeAbsentOrExpiredKey() {
            assertTrue(cache.computeIfPresent("k", v -> "x").isEmpty());
            assertTrue(cache.get("k").isEmpty());

            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(10));
            assertTrue(cache.computeIfPresent("k", v -> "x").isEmpty());
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("peek reads a live entry without changing stats")
        void peekHasNoSideEffects() {
            cache.set("k", "v");
            assertEquals("v", cache.peek("k").orElseThrow());
            assertTrue(cache.peek("missing").isEmpty());
            assertEquals(0, cache.stats().hits());
            assertEquals(0, cache.stats().misses());

            clock.advance(Duration.ofMinutes(10));
            assertTrue(cache.peek("k").isEmpty());
            assertEquals(1, cache.size(), "peek leaves expired entries for the sweeper");
        }

        @Test
        @DisplayName("computeIfPresent returning null removes the entry")
        void computeNullRemoves() {
            cache.set("k", "v");
            assertTrue(cache.computeIfPresent("k", v -> null).isEmpty());
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("sweepExpired removes only expired entries")
        void sweepRemovesExpired() {
            cache.set("old", "1");
            clock.advance(Duration.ofMinutes(6));
            cache.set("new", "2");
            clock.advance(Duration.ofMinutes(5));

            assertEquals(1, cache.sweepExpired());
            assertEquals(1, cache.size());
            assertEquals("2", cache.get("new").orElseThrow());
            assertEquals(1, cache.stats().expirations());
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("Inserting beyond capacity evicts exactly the oldest entry")
        void evictsOldestOnly() {
            cache.set("a", "1");
            clock.advance(Duration.ofSeconds(1));
            cache.set("b", "2");
            clock.advance(Duration.ofSeconds(1));
            cache.set("c", "3");
            clock.advance(Duration.ofSeconds(1));
            cache.set("d", "4");

            assertEquals(3, cache.size());
            assertTrue(cache.get("a").isEmpty());
            assertEquals("2", cache.get("b").orElseThrow());
            assertEquals("3", cache.get("c").orElseThrow());
            assertEquals("4", cache.get("d").orElseThrow());
            assertEquals(1, cache.stats().evictions());
        }

        @Test
        @DisplayName("Re-setting a key makes it the newest")
        void resetKeyMovesToTail() {
            cache.set("a", "1");
            cache.set("b", "2");
            cache.set("c", "3");
            cache.set("a", "1b");
            cache.set("d", "4");

            assertTrue(cache.get("b").isEmpty());
            assertEquals("1b", cache.get("a").orElseThrow());
        }

        @Test
        @DisplayName("Updating an existing key at capacity evicts nothing")
        void updateAtCapacityKeepsAll() {
            cache.set("a", "1");
            cache.set("b", "2");
            cache.set("c", "3");
            cache.set("b", "2b");

            assertEquals(3, cache.size());
            assertEquals(0, cache.stats().evictions());
        }
    }

    @Test
    @DisplayName("Stats track hits and misses")
    void statsTrackHitsAndMisses() {
        cache.set("k", "v");
        cache.get("k");
        cache.get("k");
        cache.get("other");

        CacheStats stats = cache.stats();
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2.0 / 3.0, stats.hitRate(), 0.0001);
        assertEquals("test", stats.name());
        assertEquals(3, stats.capacity());
    }

    @Test
    @DisplayName("Concurrent computeIfPresent calls lose no update")
    void concurrentComputeLosesNoUpdate() throws Exception {
        ExpiringCache<String, Integer> counters = new ExpiringCache<>("counters", Duration.ofMinutes(10), 3, clock);
        counters.set("k", 0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> counters.computeIfPresent("k", n -> n + 1)));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        }
        finally {
            pool.shutdownNow();
        }
        assertEquals(200, counters.get("k").orElseThrow());
    }

    @Test
    @DisplayName("Constructor rejects a non-positive TTL or capacity")
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ExpiringCache<>("bad", Duration.ZERO, 10, clock));
        assertThrows(IllegalArgumentException.class, () -> new ExpiringCache<>("bad", Duration.ofMinutes(1), 0, clock));
        assertThrows(NullPointerException.class, () -> new ExpiringCache<>("bad", Duration.ofMinutes(1), 10, null));
    }
}
