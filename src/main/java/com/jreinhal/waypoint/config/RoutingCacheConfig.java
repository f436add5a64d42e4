package com.jreinhal.waypoint.config;

import com.jreinhal.waypoint.cache.ExpiringCache;
import com.jreinhal.waypoint.model.SearchIntentResult;
import com.jreinhal.waypoint.tone.ToneCacheEntry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingCacheConfig {

    @Bean
    public Clock routingClock() {
        return Clock.systemUTC();
    }

    /**
     * Keyed by normalized message text, shared across users.
     */
    @Bean
    public ExpiringCache<String, SearchIntentResult> searchIntentCache(RoutingProperties properties, Clock clock) {
        RoutingProperties.Cache cfg = properties.getCache();
        return new ExpiringCache<>("search-intent", cfg.getSearchIntentTtl(), cfg.getSearchIntentMaxEntries(), clock);
    }

    /**
     * Keyed by user id.
     */
    @Bean
    public ExpiringCache<String, ToneCacheEntry> toneCache(RoutingProperties properties, Clock clock) {
        RoutingProperties.Cache cfg = properties.getCache();
        return new ExpiringCache<>("tone", cfg.getToneTtl(), cfg.getToneMaxEntries(), clock);
    }
}
