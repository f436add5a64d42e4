package com.jreinhal.waypoint.cache;

public record CacheStats(String name, int size, int capacity, long hits, long misses, long evictions,
        long expirations) {

    public double hitRate() {
        long lookups = this.hits + this.misses;
        return lookups == 0 ? 0.0 : (double) this.hits / (double) lookups;
    }
}
