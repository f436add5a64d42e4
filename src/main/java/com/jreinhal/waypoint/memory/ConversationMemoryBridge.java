package com.jreinhal.waypoint.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.jreinhal.waypoint.classifier.PatternClassifier;
import com.jreinhal.waypoint.config.RoutingProperties;
import com.jreinhal.waypoint.model.Domain;
import com.jreinhal.waypoint.model.LastSearchQuery;
import com.jreinhal.waypoint.model.SearchType;
import com.jreinhal.waypoint.rules.RoutingRules;
import com.jreinhal.waypoint.util.LogSanitizer;
import com.jreinhal.waypoint.util.TextNormalizer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Remembers, per user, the last query that triggered a search so a later "check again" can repeat it.
 *
 * <p>Entries live for hours ({@code waypoint.routing.cache.last-search-ttl}). When the entry is gone
 * and a {@link MemoryStore} is available, the most recent search-worthy user turn is used instead.</p>
 */
@Component
public class ConversationMemoryBridge {
    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryBridge.class);

    private final Cache<String, LastSearchQuery> lastSearches;
    private final Clock clock;
    private final PatternClassifier classifier;
    private final MemoryStore memoryStore;
    private final int contextLimit;

    public ConversationMemoryBridge(RoutingProperties properties, Clock clock, PatternClassifier classifier,
            @Nullable MemoryStore memoryStore) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.memoryStore = memoryStore;
        this.contextLimit = Math.max(1, properties.getMemoryContextLimit());
        RoutingProperties.Cache cfg = properties.getCache();
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.lastSearches = Caffeine.newBuilder()
                .maximumSize(cfg.getLastSearchMaxEntries())
                .expireAfterWrite(cfg.getLastSearchTtl())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        if (memoryStore == null) {
            log.info("No MemoryStore available; recheck relies on the last-search cache only");
        }
    }

    public void remember(String userId, String query, Domain domain, SearchType searchType) {
        if (userId == null || query == null || query.isBlank()) {
            return;
        }
        this.lastSearches.put(userId, new LastSearchQuery(query, domain, searchType, this.clock.instant()));
    }

    public Optional<LastSearchQuery> lastSearch(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.lastSearches.getIfPresent(userId));
    }

    /**
     * Topic for a recheck request: the cached last search, else a search-worthy turn recovered from
     * the memory store. Empty means the recheck should be ignored.
     */
    public Optional<LastSearchQuery> resolveRecheckTopic(String userId, RoutingRules rules) {
        Optional<LastSearchQuery> cached = this.lastSearch(userId);
        if (cached.isPresent()) {
            return cached;
        }
        return this.recoverFromMemory(userId, rules);
    }

    public void forget(String userId) {
        this.lastSearches.invalidate(userId);
    }

    public long size() {
        return this.lastSearches.estimatedSize();
    }

    public void cleanUp() {
        this.lastSearches.cleanUp();
    }

    private Optional<LastSearchQuery> recoverFromMemory(String userId, RoutingRules rules) {
        if (this.memoryStore == null || userId == null) {
            return Optional.empty();
        }
        List<ConversationTurn> turns;
        try {
            turns = this.memoryStore.getRecentContext(userId, this.contextLimit);
        }
        catch (RuntimeException e) {
            log.warn("MemoryStore lookup failed; treating recheck as having no context: {}",
                    LogSanitizer.sanitize(e.getMessage()));
            return Optional.empty();
        }
        if (turns == null) {
            return Optional.empty();
        }
        for (int i = turns.size() - 1; i >= 0; --i) {
            ConversationTurn turn = turns.get(i);
            if (turn == null || !turn.isUser() || turn.content() == null || turn.content().isBlank()) {
                continue;
            }
            String content = turn.content();
            if (this.classifier.isRecheckRequest(content, rules) || this.classifier.isGreeting(content, rules)) {
                continue;
            }
            Optional<RoutingRules.KeywordCategory> category = this.classifier.matchCategory(content, rules);
            if (category.isEmpty()) {
                continue;
            }
            Domain domain = category.get().domain();
            SearchType type = domain == Domain.LOCAL ? SearchType.LOCAL : SearchType.WEB;
            Instant when = turn.timestamp() == null ? this.clock.instant() : turn.timestamp();
            log.debug("Recovered recheck topic from memory store ({} turns scanned)", turns.size() - i);
            return Optional.of(new LastSearchQuery(TextNormalizer.collapseWhitespace(content), domain, type, when));
        }
        return Optional.empty();
    }
}
