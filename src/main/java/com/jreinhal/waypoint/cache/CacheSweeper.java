package com.jreinhal.waypoint.cache;

import com.jreinhal.waypoint.memory.ConversationMemoryBridge;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired entries so memory stays bounded between reads.
 */
@Component
public class CacheSweeper {
    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final List<ExpiringCache<?, ?>> caches;
    private final ConversationMemoryBridge memoryBridge;

    public CacheSweeper(List<ExpiringCache<?, ?>> caches, ConversationMemoryBridge memoryBridge) {
        this.caches = List.copyOf(caches);
        this.memoryBridge = memoryBridge;
    }

    @Scheduled(fixedDelayString = "${waypoint.routing.cache.sweep-interval-ms:60000}",
            initialDelayString = "${waypoint.routing.cache.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = 0;
        for (ExpiringCache<?, ?> cache : this.caches) {
            removed += cache.sweepExpired();
        }
        this.memoryBridge.cleanUp();
        if (removed > 0) {
            log.debug("Cache sweep removed {} expired entries across {} caches", removed, this.caches.size());
        }
    }

    public List<CacheStats> stats() {
        return this.caches.stream().map(ExpiringCache::stats).toList();
    }
}
