package com.jreinhal.waypoint.rules;

import com.jreinhal.waypoint.config.RoutingProperties;
import com.jreinhal.waypoint.model.Domain;
import com.jreinhal.waypoint.model.UserIntent;
import com.jreinhal.waypoint.support.MutableClock;
import com.jreinhal.waypoint.support.RoutingFixtures;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RoutingRulesRegistryTest {

    private MutableClock clock;
    private RoutingRulesRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = RoutingFixtures.registry(clock);
    }

    @Nested
    @DisplayName("Bundled defaults")
    class Defaults {

        @Test
        @DisplayName("Categories keep document order")
        void categoriesKeepDocumentOrder() {
            assertThat(registry.current().categories())
                    .extracting(RoutingRules.KeywordCategory::name)
                    .containsExactly("time", "info", "entertainment", "news", "finance", "weather", "sports",
                            "festivals", "local", "tech");
        }

        @Test
        @DisplayName("Category domains come from the domain map")
        void categoryDomainsMapped() {
            RoutingRules rules = registry.current();
            assertEquals(Domain.LOCAL, rules.matchCategory("pizza near me").orElseThrow().domain());
            assertEquals(Domain.ENTERTAINMENT, rules.matchCategory("cricket highlights").orElseThrow().domain());
            assertEquals(Domain.FINANCE, rules.matchCategory("sensex chart").orElseThrow().domain());
        }

        @Test
        @DisplayName("Every no-search intent table is compiled")
        void noSearchTablesCompiled() {
            assertThat(registry.current().noSearchPatterns().keySet())
                    .containsExactly(UserIntent.GRATITUDE, UserIntent.FAREWELL, UserIntent.COMPLIMENT,
                            UserIntent.GREETING, UserIntent.AGREEMENT);
        }

        @Test
        @DisplayName("Stats reflect the loaded tables")
        void statsReflectTables() {
            RulesStats stats = registry.stats();
            assertEquals(10, stats.categories());
            assertEquals(150, stats.keywords());
            assertEquals(67, stats.greetings());
            assertEquals(9, stats.domainSuffixes());
            assertEquals(37, stats.stopWords());
            assertEquals(clock.instant(), stats.lastUpdated());
        }

        @Test
        @DisplayName("Unknown domain falls back to the general suffix")
        void unknownSuffixFallsBackToGeneral() {
            RoutingRules rules = registry.current();
            assertEquals(" latest today India", rules.domainSuffix(Domain.GENERAL));
            assertEquals(" near me location address contact phone number", rules.domainSuffix(Domain.LOCAL));
        }

        @Test
        @DisplayName("Missing rules resource fails startup")
        void missingResourceFails() {
            RoutingProperties properties = new RoutingProperties();
            properties.setRulesLocation("classpath:waypoint/does-not-exist.json");
            assertThrows(IllegalStateException.class, () -> RoutingFixtures.registry(properties, clock));
        }
    }

    @Nested
    @DisplayName("Hot reload")
    class Reload {

        @Test
        @DisplayName("A partial document only replaces the sections it names")
        void partialOverlay() {
            clock.advance(Duration.ofMinutes(5));
            RoutingRules reloaded = registry.loadFromJson("{\"simpleGreetings\": [\"yo\", \"Sup!\"]}");

            assertThat(reloaded.greetings()).containsExactly("yo", "sup");
            assertEquals(10, reloaded.categories().size());
            assertSame(reloaded, registry.current());
            assertEquals(Instant.parse("2026-01-15T10:05:00Z"), registry.stats().lastUpdated());
        }

        @Test
        @DisplayName("Nested sections overlay field by field")
        void nestedOverlay() {
            RoutingRules reloaded = registry.loadFromJson("{\"intentKeywords\": {\"news\": [\"bulletin\"]}}");

            assertTrue(reloaded.newsPattern().matcher("evening bulletin").find());
            assertFalse(reloaded.newsPattern().matcher("latest news").find());
            assertTrue(reloaded.localPattern().matcher("cafe near me").find());
        }

        @Test
        @DisplayName("A document referencing an unknown category is rejected and the old rules stay")
        void unknownCategoryRejected() {
            RoutingRules before = registry.current();

            assertThrows(RoutingRulesException.class,
                    () -> registry.loadFromJson("{\"categoryDomainMap\": {\"space\": \"general\"}}"));
            assertSame(before, registry.current());
        }

        @Test
        @DisplayName("Unknown domain names are rejected")
        void unknownDomainRejected() {
            RoutingRules before = registry.current();

            RoutingRulesException error = assertThrows(RoutingRulesException.class,
                    () -> registry.loadFromJson("{\"domainSuffixes\": {\"space\": \" nasa\"}}"));
            assertThat(error.getMessage()).contains("space");
            assertSame(before, registry.current());
        }

        @Test
        @DisplayName("Unknown intent names are rejected")
        void unknownIntentRejected() {
            assertThrows(RoutingRulesException.class,
                    () -> registry.loadFromJson("{\"intentKeywords\": {\"noSearch\": {\"boredom\": [\"meh\"]}}}"));
        }

        @Test
        @DisplayName("Blank entries and empty keyword lists are rejected")
        void blankEntriesRejected() {
            assertThrows(RoutingRulesException.class,
                    () -> registry.loadFromJson("{\"stopWords\": [\"the\", \" \"]}"));
            assertThrows(RoutingRulesException.class,
                    () -> registry.loadFromJson("{\"searchKeywords\": {\"time\": []}}"));
            assertThrows(RoutingRulesException.class,
                    () -> registry.loadFromJson("{\"simpleGreetings\": []}"));
        }

        @Test
        @DisplayName("Malformed JSON and unknown sections are rejected")
        void malformedRejected() {
            RoutingRules before = registry.current();

            assertThrows(RoutingRulesException.class, () -> registry.loadFromJson("{not json"));
            assertThrows(RoutingRulesException.class, () -> registry.loadFromJson("{\"bogusSection\": []}"));
            assertThrows(RoutingRulesException.class, () -> registry.loadFromJson("  "));
            assertSame(before, registry.current());
        }

        @Test
        @DisplayName("Reset restores the bundled tables")
        void resetRestoresDefaults() {
            registry.loadFromJson("{\"simpleGreetings\": [\"yo\"]}");

            RoutingRules restored = registry.resetToDefaults();

            assertTrue(restored.isGreeting("namaste"));
            assertSame(restored, registry.current());
        }

        @Test
        @DisplayName("Exported rules can be loaded back unchanged")
        void exportReloads() {
            registry.loadFromJson("{\"stopWords\": [\"umm\"]}");
            String exported = registry.exportToJson();

            assertThat(exported).contains("\"searchKeywords\"").contains("umm");
            registry.resetToDefaults();
            RoutingRules reloaded = registry.loadFromJson(exported);
            assertTrue(reloaded.isStopWord("umm"));
            assertFalse(reloaded.isStopWord("the"));
        }
    }

    @Nested
    @DisplayName("Snapshot immutability")
    class Immutability {

        @Test
        @DisplayName("The active document cannot be changed in place")
        void sourceIsUnmodifiable() {
            RoutingRulesDocument source = registry.current().source();

            assertThrows(UnsupportedOperationException.class, () -> source.stopWords().add("pizza"));
            assertThrows(UnsupportedOperationException.class, () -> source.searchKeywords().get("local").clear());
            assertThrows(UnsupportedOperationException.class, () -> source.searchKeywords().remove("time"));
            assertThrows(UnsupportedOperationException.class, () -> source.domainSuffixes().put("tech", " x"));
            assertThrows(UnsupportedOperationException.class,
                    () -> source.intentKeywords().noSearch().get("gratitude").add("cheers"));
            assertThrows(UnsupportedOperationException.class, () -> source.complexityPatterns().high().clear());
            assertThrows(UnsupportedOperationException.class,
                    () -> registry.current().categories().get(0).keywords().add("pizza"));
        }

        @Test
        @DisplayName("Reloaded documents are frozen too")
        void reloadedSourceIsUnmodifiable() {
            registry.loadFromJson("{\"stopWords\": [\"umm\"], \"searchKeywords\": {\"space\": [\"nasa\"]}}");
            RoutingRulesDocument source = registry.current().source();

            assertThrows(UnsupportedOperationException.class, () -> source.stopWords().add("pizza"));
            assertThrows(UnsupportedOperationException.class, () -> source.searchKeywords().get("space").clear());
        }

        @Test
        @DisplayName("Export, reset and later reloads agree with the active rules")
        void exportMatchesActiveRules() {
            assertThrows(UnsupportedOperationException.class,
                    () -> registry.current().source().stopWords().add("pizza"));
            registry.loadFromJson("{\"recheckPhrases\": [\"again\"]}");
            assertFalse(registry.current().isStopWord("pizza"));

            registry.resetToDefaults();
            assertThat(registry.exportToJson()).doesNotContain("pizza");
            assertFalse(registry.current().isStopWord("pizza"));
        }
    }

    @Nested
    @DisplayName("Single-entry edits")
    class Edits {

        @Test
        @DisplayName("Adding a keyword extends its category and stamps the update")
        void addKeyword() {
            clock.advance(Duration.ofMinutes(3));

            RoutingRules rules = registry.addSearchKeyword("sports", "kabaddi");

            assertEquals("sports", rules.matchCategory("kabaddi league").orElseThrow().name());
            assertEquals(151, rules.keywordCount());
            assertSame(rules, registry.current());
            assertEquals(Instant.parse("2026-01-15T10:03:00Z"), registry.stats().lastUpdated());
        }

        @Test
        @DisplayName("A keyword for a new category creates it at the end of the table")
        void addKeywordNewCategory() {
            RoutingRules rules = registry.addSearchKeyword("space", "nasa");

            RoutingRules.KeywordCategory last = rules.categories().get(rules.categories().size() - 1);
            assertEquals("space", last.name());
            assertEquals(Domain.GENERAL, last.domain());
            assertEquals("space", rules.matchCategory("nasa launch").orElseThrow().name());
        }

        @Test
        @DisplayName("Adding an existing keyword changes nothing")
        void addDuplicateKeyword() {
            RoutingRules before = registry.current();
            Instant stamped = registry.stats().lastUpdated();
            clock.advance(Duration.ofMinutes(1));

            assertSame(before, registry.addSearchKeyword("weather", "mausam"));
            assertEquals(stamped, registry.stats().lastUpdated());
        }

        @Test
        @DisplayName("Removing a keyword stops it matching")
        void removeKeyword() {
            RoutingRules rules = registry.removeSearchKeyword("weather", "mausam");

            assertTrue(rules.matchCategory("mausam").isEmpty());
            assertEquals("weather", rules.matchCategory("weather").orElseThrow().name());
        }

        @Test
        @DisplayName("Removing from an unknown category changes nothing")
        void removeFromUnknownCategory() {
            RoutingRules before = registry.current();

            assertSame(before, registry.removeSearchKeyword("space", "nasa"));
        }

        @Test
        @DisplayName("Removing a category's last keyword is rejected and the old rules stay")
        void removeLastKeywordRejected() {
            RoutingRules withSpace = registry.addSearchKeyword("space", "nasa");

            assertThrows(RoutingRulesException.class, () -> registry.removeSearchKeyword("space", "nasa"));
            assertSame(withSpace, registry.current());
        }

        @Test
        @DisplayName("Greetings can be added and removed")
        void addAndRemoveGreeting() {
            assertTrue(registry.addGreeting("Yo").isGreeting("yo"));
            assertEquals(68, registry.stats().greetings());

            RoutingRules rules = registry.removeGreeting("NAMASTE");
            assertFalse(rules.isGreeting("namaste"));
            assertTrue(rules.isGreeting("yo"));
        }

        @Test
        @DisplayName("Removing the last greeting is rejected")
        void removeLastGreetingRejected() {
            RoutingRules onlyYo = registry.loadFromJson("{\"simpleGreetings\": [\"yo\"]}");

            assertThrows(RoutingRulesException.class, () -> registry.removeGreeting("yo"));
            assertSame(onlyYo, registry.current());
        }

        @Test
        @DisplayName("Blank arguments are rejected")
        void blankArgumentsRejected() {
            assertThrows(RoutingRulesException.class, () -> registry.addSearchKeyword("sports", " "));
            assertThrows(RoutingRulesException.class, () -> registry.addSearchKeyword(null, "kabaddi"));
            assertThrows(RoutingRulesException.class, () -> registry.addGreeting(""));
        }
    }
}
