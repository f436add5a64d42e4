package com.jreinhal.waypoint.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable slot held by exactly one {@link ExpiringCache}. Updates replace the entry, never mutate it.
 */
public record CacheEntry<T>(T value, Instant insertedAt) {

    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(this.insertedAt.plus(ttl));
    }
}
