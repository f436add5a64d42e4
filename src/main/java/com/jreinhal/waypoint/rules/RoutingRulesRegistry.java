package com.jreinhal.waypoint.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.jreinhal.waypoint.config.RoutingProperties;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Holds the active {@link RoutingRules} and swaps them atomically on reload.
 *
 * <p>A reload is a partial overlay on the active rules; single keywords and greetings can also be
 * added or removed. The edited document is validated and compiled before the swap; if anything
 * fails, the previous rules stay active and {@link RoutingRulesException} is thrown. Readers call {@link #current()} once per request and
 * work from that snapshot.</p>
 */
@Component
public class RoutingRulesRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoutingRulesRegistry.class);

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final Resource defaultsResource;
    private final Clock clock;
    private final RoutingRules defaults;
    private final AtomicReference<Snapshot> active = new AtomicReference<>();

    private record Snapshot(RoutingRules rules, Instant lastUpdated) {
    }

    public RoutingRulesRegistry(RoutingProperties properties, ObjectMapper objectMapper, ResourceLoader resourceLoader,
            Clock clock) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(RoutingRulesDocument.class)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
        this.defaultsResource = resourceLoader.getResource(properties.getRulesLocation());
        // A broken bundled document is a deployment error: fail startup rather than route without rules.
        this.defaults = RoutingRules.compile(this.readDefaults());
        this.active.set(new Snapshot(this.defaults, clock.instant()));
        log.info("Routing rules loaded from {}: {} categories, {} keywords, {} greetings",
                properties.getRulesLocation(), this.defaults.categories().size(), this.defaults.keywordCount(),
                this.defaults.greetings().size());
    }

    public RoutingRules current() {
        return this.active.get().rules();
    }

    /**
     * Overlays the sections present in {@code json} on the active rules.
     *
     * @throws RoutingRulesException if the document is malformed or the merged rules are invalid
     */
    public RoutingRules loadFromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new RoutingRulesException("Rule document is empty");
        }
        RoutingRulesDocument patch;
        try {
            patch = this.strictReader.readValue(json);
        }
        catch (JsonProcessingException e) {
            log.warn("Rejected routing rules reload: {}", e.getOriginalMessage());
            throw new RoutingRulesException("Malformed rule document: " + e.getOriginalMessage(), e);
        }
        return this.update("reload", document -> RoutingRulesDocument.overlay(document, patch));
    }

    /**
     * Adds a keyword to a search category, creating the category at the end of the table if it is new.
     */
    public RoutingRules addSearchKeyword(String category, String keyword) {
        String name = requireText(category, "category");
        String value = requireText(keyword, "keyword");
        return this.update("add keyword to '" + name + "'", document -> {
            List<String> keywords = new ArrayList<>(document.searchKeywords().getOrDefault(name, List.of()));
            if (keywords.contains(value)) {
                return document;
            }
            keywords.add(value);
            Map<String, List<String>> table = new LinkedHashMap<>(document.searchKeywords());
            table.put(name, keywords);
            return document.withSearchKeywords(table);
        });
    }

    /**
     * Removes a keyword from a search category. Removing a category's last keyword is rejected.
     */
    public RoutingRules removeSearchKeyword(String category, String keyword) {
        String name = requireText(category, "category");
        String value = requireText(keyword, "keyword");
        return this.update("remove keyword from '" + name + "'", document -> {
            List<String> keywords = document.searchKeywords().get(name);
            if (keywords == null || !keywords.contains(value)) {
                return document;
            }
            List<String> remaining = new ArrayList<>(keywords);
            remaining.remove(value);
            Map<String, List<String>> table = new LinkedHashMap<>(document.searchKeywords());
            table.put(name, remaining);
            return document.withSearchKeywords(table);
        });
    }

    public RoutingRules addGreeting(String greeting) {
        String value = requireText(greeting, "greeting").toLowerCase(Locale.ROOT);
        return this.update("add greeting", document -> {
            if (document.simpleGreetings().contains(value)) {
                return document;
            }
            List<String> greetings = new ArrayList<>(document.simpleGreetings());
            greetings.add(value);
            return document.withSimpleGreetings(greetings);
        });
    }

    /**
     * Removes a greeting. Removing the last greeting is rejected.
     */
    public RoutingRules removeGreeting(String greeting) {
        String value = requireText(greeting, "greeting").toLowerCase(Locale.ROOT);
        return this.update("remove greeting", document -> {
            List<String> greetings = new ArrayList<>(document.simpleGreetings());
            if (!greetings.removeIf(existing -> existing.trim().toLowerCase(Locale.ROOT).equals(value))) {
                return document;
            }
            return document.withSimpleGreetings(greetings);
        });
    }

    public RoutingRules resetToDefaults() {
        this.active.set(new Snapshot(this.defaults, this.clock.instant()));
        log.info("Routing rules reset to defaults");
        return this.defaults;
    }

    public String exportToJson() {
        try {
            return this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(this.current().source());
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize active routing rules", e);
        }
    }

    public RulesStats stats() {
        Snapshot snapshot = this.active.get();
        RoutingRules rules = snapshot.rules();
        return new RulesStats(rules.categories().size(), rules.keywordCount(), rules.greetings().size(),
                rules.domainSuffixes().size(), rules.stopWords().size(), snapshot.lastUpdated());
    }

    /**
     * Applies an edit to the active document, then validates, compiles and swaps. An edit that returns
     * the document unchanged leaves the rules and their timestamp alone.
     */
    private RoutingRules update(String action, UnaryOperator<RoutingRulesDocument> edit) {
        Snapshot previous = this.active.get();
        RoutingRulesDocument current = previous.rules().source();
        RoutingRulesDocument edited = edit.apply(current);
        if (edited == current) {
            return previous.rules();
        }
        RoutingRules next;
        try {
            next = RoutingRules.compile(edited);
        }
        catch (RoutingRulesException e) {
            log.warn("Rejected routing rules {}: {}", action, e.getMessage());
            throw e;
        }
        if (!this.active.compareAndSet(previous, new Snapshot(next, this.clock.instant()))) {
            throw new RoutingRulesException("Routing rules changed concurrently; " + action + " again");
        }
        log.info("Routing rules {} applied: {} categories, {} keywords, {} greetings", action,
                next.categories().size(), next.keywordCount(), next.greetings().size());
        return next;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new RoutingRulesException(name + " must not be blank");
        }
        return value.trim();
    }

    private RoutingRulesDocument readDefaults() {
        if (!this.defaultsResource.exists()) {
            throw new IllegalStateException("Routing rules resource not found: " + this.defaultsResource.getDescription());
        }
        try (InputStream in = this.defaultsResource.getInputStream()) {
            return this.strictReader.readValue(in);
        }
        catch (IOException e) {
            throw new IllegalStateException("Unable to read routing rules from " + this.defaultsResource.getDescription(), e);
        }
    }
}
