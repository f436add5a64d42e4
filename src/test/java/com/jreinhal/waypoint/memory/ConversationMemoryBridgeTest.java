package com.jreinhal.waypoint.memory;

import com.jreinhal.waypoint.classifier.PatternClassifier;
import com.jreinhal.waypoint.config.RoutingProperties;
import com.jreinhal.waypoint.model.Domain;
import com.jreinhal.waypoint.model.LastSearchQuery;
import com.jreinhal.waypoint.model.SearchType;
import com.jreinhal.waypoint.rules.RoutingRules;
import com.jreinhal.waypoint.rules.RoutingRulesRegistry;
import com.jreinhal.waypoint.support.MutableClock;
import com.jreinhal.waypoint.support.RoutingFixtures;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConversationMemoryBridgeTest {

    private MutableClock clock;
    private RoutingProperties properties;
    private PatternClassifier classifier;
    private RoutingRules rules;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        properties = new RoutingProperties();
        RoutingRulesRegistry registry = RoutingFixtures.registry(clock);
        classifier = RoutingFixtures.classifier(registry);
        rules = registry.current();
    }

    private static ConversationTurn user(String content) {
        return new ConversationTurn(ConversationTurn.Role.USER, content, Instant.parse("2026-01-15T09:00:00Z"));
    }

    private static ConversationTurn assistant(String content) {
        return new ConversationTurn(ConversationTurn.Role.ASSISTANT, content, Instant.parse("2026-01-15T09:00:05Z"));
    }

    @Nested
    @DisplayName("Last search cache")
    class LastSearch {

        @Test
        void remembersPerUser() {
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, null);

            bridge.remember("u1", "IPL score today", Domain.ENTERTAINMENT, SearchType.WEB);

            LastSearchQuery last = bridge.lastSearch("u1").orElseThrow();
            assertEquals("IPL score today", last.query());
            assertEquals(Domain.ENTERTAINMENT, last.domain());
            assertEquals(SearchType.WEB, last.searchType());
            assertEquals(clock.instant(), last.timestamp());
            assertTrue(bridge.lastSearch("u2").isEmpty());
        }

        @Test
        void laterSearchReplacesEarlier() {
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, null);

            bridge.remember("u1", "IPL score today", Domain.ENTERTAINMENT, SearchType.WEB);
            bridge.remember("u1", "gold price today", Domain.FINANCE, SearchType.WEB);

            assertEquals("gold price today", bridge.lastSearch("u1").orElseThrow().query());
        }

        @Test
        void ignoresBlankQueriesAndMissingUser() {
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, null);

            bridge.remember("u1", "  ", Domain.GENERAL, SearchType.WEB);
            bridge.remember(null, "IPL score", Domain.GENERAL, SearchType.WEB);

            assertTrue(bridge.lastSearch("u1").isEmpty());
            assertTrue(bridge.lastSearch(null).isEmpty());
        }

        @Test
        void expiresAfterTtl() {
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, null);
            bridge.remember("u1", "IPL score today", Domain.ENTERTAINMENT, SearchType.WEB);

            clock.advance(Duration.ofHours(5));
            assertTrue(bridge.lastSearch("u1").isPresent());
            clock.advance(Duration.ofHours(2));
            assertTrue(bridge.lastSearch("u1").isEmpty());
        }

        @Test
        void forgetDropsEntry() {
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, null);
            bridge.remember("u1", "IPL score today", Domain.ENTERTAINMENT, SearchType.WEB);

            bridge.forget("u1");

            assertTrue(bridge.lastSearch("u1").isEmpty());
        }
    }

    @Nested
    @DisplayName("Recheck topic resolution")
    class RecheckTopic {

        @Test
        void cachedSearchWinsWithoutTouchingStore() {
            MemoryStore store = mock(MemoryStore.class);
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, store);
            bridge.remember("u1", "IPL score today", Domain.ENTERTAINMENT, SearchType.WEB);

            Optional<LastSearchQuery> topic = bridge.resolveRecheckTopic("u1", rules);

            assertEquals("IPL score today", topic.orElseThrow().query());
            verifyNoInteractions(store);
        }

        @Test
        void recoversMostRecentSearchWorthyUserTurn() {
            MemoryStore store = mock(MemoryStore.class);
            when(store.getRecentContext("u1", 10)).thenReturn(List.of(
                    user("sensex kaisa hai"),
                    assistant("Sensex closed higher."),
                    user("IPL score today"),
                    assistant("Here is the live score."),
                    user("thanks"),
                    user("dobara check karo")));
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, store);

            LastSearchQuery topic = bridge.resolveRecheckTopic("u1", rules).orElseThrow();

            assertEquals("IPL score today", topic.query());
            assertEquals(SearchType.WEB, topic.searchType());
            assertEquals(Instant.parse("2026-01-15T09:00:00Z"), topic.timestamp());
        }

        @Test
        void localTopicKeepsLocalSearchType() {
            MemoryStore store = mock(MemoryStore.class);
            when(store.getRecentContext(anyString(), anyInt())).thenReturn(List.of(user("best dosa  near me")));
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, store);

            LastSearchQuery topic = bridge.resolveRecheckTopic("u1", rules).orElseThrow();

            assertEquals("best dosa near me", topic.query());
            assertEquals(Domain.LOCAL, topic.domain());
            assertEquals(SearchType.LOCAL, topic.searchType());
        }

        @Test
        void nothingSearchWorthyMeansNoTopic() {
            MemoryStore store = mock(MemoryStore.class);
            when(store.getRecentContext(anyString(), anyInt())).thenReturn(List.of(
                    user("hello"), assistant("IPL score today is 180/4"), user("tell me a joke")));
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, store);

            assertTrue(bridge.resolveRecheckTopic("u1", rules).isEmpty());
        }

        @Test
        void storeFailureMeansNoTopic() {
            MemoryStore store = mock(MemoryStore.class);
            when(store.getRecentContext(anyString(), anyInt())).thenThrow(new IllegalStateException("store offline"));
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, store);

            assertTrue(bridge.resolveRecheckTopic("u1", rules).isEmpty());
        }

        @Test
        void noStoreMeansNoTopic() {
            ConversationMemoryBridge bridge = new ConversationMemoryBridge(properties, clock, classifier, null);

            assertTrue(bridge.resolveRecheckTopic("u1", rules).isEmpty());
        }
    }
}
