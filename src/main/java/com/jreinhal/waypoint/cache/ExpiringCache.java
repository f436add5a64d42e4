package com.jreinhal.waypoint.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TTL and size bounded key/value store.
 *
 * <p>Entries expire lazily on read and proactively via {@link #sweepExpired()}. Once the cache is at
 * capacity, inserting a new key evicts the single oldest entry. Entries are kept in insertion order,
 * so the oldest entry is always the head of the map.</p>
 *
 * <p>All operations are synchronized on the instance. Values should be immutable; updates go through
 * {@link #set} or {@link #computeIfPresent}, which swap the whole {@link CacheEntry}.</p>
 */
public class ExpiringCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(ExpiringCache.class);

    private final String name;
    private final Duration ttl;
    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<K, CacheEntry<V>> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ExpiringCache(String name, Duration ttl, int capacity, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache '" + name + "' requires a positive TTL");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache '" + name + "' requires capacity >= 1");
        }
        this.ttl = ttl;
        this.capacity = capacity;
    }

    public synchronized Optional<V> get(K key) {
        CacheEntry<V> entry = this.entries.get(key);
        if (entry == null) {
            ++this.misses;
            return Optional.empty();
        }
        if (entry.isExpired(this.clock.instant(), this.ttl)) {
            this.entries.remove(key);
            ++this.expirations;
            ++this.misses;
            return Optional.empty();
        }
        ++this.hits;
        return Optional.of(entry.value());
    }

    /**
     * Live value for the key without touching stats, expiry or entry order.
     */
    public synchronized Optional<V> peek(K key) {
        CacheEntry<V> entry = this.entries.get(key);
        if (entry == null || entry.isExpired(this.clock.instant(), this.ttl)) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public synchronized void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        // Re-inserting moves the key to the tail so age order matches insertedAt order.
        if (this.entries.remove(key) == null && this.entries.size() >= this.capacity) {
            this.evictOldest();
        }
        this.entries.put(key, new CacheEntry<>(value, this.clock.instant()));
    }

    /**
     * Applies {@code remapping} to a live entry under the cache lock, keeping its original insertion
     * time so the TTL is not extended. A null result removes the entry. Returns the new value, or
     * empty when the key was absent, expired or removed.
     */
    public synchronized Optional<V> computeIfPresent(K key, UnaryOperator<V> remapping) {
        Objects.requireNonNull(remapping, "remapping");
        CacheEntry<V> current = this.entries.get(key);
        if (current == null) {
            ++this.misses;
            return Optional.empty();
        }
        if (current.isExpired(this.clock.instant(), this.ttl)) {
            this.entries.remove(key);
            ++this.expirations;
            ++this.misses;
            return Optional.empty();
        }
        V next = remapping.apply(current.value());
        if (next == null) {
            this.entries.remove(key);
            ++this.misses;
            return Optional.empty();
        }
        ++this.hits;
        this.entries.put(key, new CacheEntry<>(next, current.insertedAt()));
        return Optional.of(next);
    }

    public synchronized void clear(K key) {
        this.entries.remove(key);
    }

    public synchronized void clear() {
        this.entries.clear();
    }

    /**
     * Removes every expired entry. Returns the number removed.
     */
    public synchronized int sweepExpired() {
        Instant now = this.clock.instant();
        int removed = 0;
        Iterator<Map.Entry<K, CacheEntry<V>>> iterator = this.entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue().isExpired(now, this.ttl)) {
                iterator.remove();
                ++removed;
            }
        }
        this.expirations += removed;
        if (removed > 0 && log.isDebugEnabled()) {
            log.debug("Cache '{}' swept {} expired entries, {} remain", this.name, removed, this.entries.size());
        }
        return removed;
    }

    public synchronized int size() {
        return this.entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(this.name, this.entries.size(), this.capacity, this.hits, this.misses,
                this.evictions, this.expirations);
    }

    private void evictOldest() {
        Iterator<K> iterator = this.entries.keySet().iterator();
        if (iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            ++this.evictions;
        }
    }
}
