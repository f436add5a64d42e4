package com.jreinhal.waypoint.rules;

import com.jreinhal.waypoint.model.Domain;
import com.jreinhal.waypoint.model.UserIntent;
import com.jreinhal.waypoint.util.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiled, immutable snapshot of the rule tables. A reload builds a new instance and swaps it in;
 * an instance is never modified after {@link #compile}.
 */
public final class RoutingRules {

    public record KeywordCategory(String name, Domain domain, List<String> keywords, Pattern pattern) {
    }

    private final RoutingRulesDocument source;
    private final List<KeywordCategory> categories;
    private final Set<String> greetings;
    private final Map<Domain, String> domainSuffixes;
    private final Pattern complexityHigh;
    private final Pattern complexityMedium;
    private final Set<String> stopWords;
    private final Pattern hindiPattern;
    private final Pattern recheckPattern;
    private final Pattern sequelContextPattern;
    private final Map<UserIntent, Pattern> noSearchPatterns;
    private final Pattern newsPattern;
    private final Pattern localPattern;
    private final Pattern shoppingPattern;
    private final Pattern knowledgePattern;
    private final int keywordCount;

    private RoutingRules(RoutingRulesDocument source, List<KeywordCategory> categories, Set<String> greetings,
            Map<Domain, String> domainSuffixes, Map<UserIntent, Pattern> noSearchPatterns) {
        this.source = source;
        this.categories = List.copyOf(categories);
        this.greetings = Collections.unmodifiableSet(greetings);
        this.domainSuffixes = Collections.unmodifiableMap(domainSuffixes);
        this.complexityHigh = TextNormalizer.phrasePattern(source.complexityPatterns().high());
        this.complexityMedium = TextNormalizer.phrasePattern(source.complexityPatterns().medium());
        this.stopWords = Collections.unmodifiableSet(lowercase(source.stopWords()));
        this.hindiPattern = TextNormalizer.phrasePattern(source.hindiPatterns());
        this.recheckPattern = TextNormalizer.phrasePattern(source.recheckPhrases());
        this.sequelContextPattern = TextNormalizer.phrasePattern(source.sequelContextKeywords());
        this.noSearchPatterns = Collections.unmodifiableMap(noSearchPatterns);
        RoutingRulesDocument.IntentKeywords intents = source.intentKeywords();
        this.newsPattern = TextNormalizer.phrasePattern(intents.news());
        this.localPattern = TextNormalizer.phrasePattern(intents.local());
        this.shoppingPattern = TextNormalizer.phrasePattern(intents.shopping());
        this.knowledgePattern = TextNormalizer.phrasePattern(intents.knowledge());
        this.keywordCount = categories.stream().mapToInt(c -> c.keywords().size()).sum();
    }

    /**
     * Validates a complete document and compiles it.
     *
     * @throws RoutingRulesException if any section is missing or invalid
     */
    public static RoutingRules compile(RoutingRulesDocument document) {
        if (document == null) {
            throw new RoutingRulesException("Rule document is empty");
        }
        Map<String, List<String>> keywordTable = require(document.searchKeywords(), "searchKeywords");
        if (keywordTable.isEmpty()) {
            throw new RoutingRulesException("searchKeywords must define at least one category");
        }
        Map<String, String> categoryDomainMap = require(document.categoryDomainMap(), "categoryDomainMap");
        for (String category : categoryDomainMap.keySet()) {
            if (!keywordTable.containsKey(category)) {
                throw new RoutingRulesException("categoryDomainMap references unknown category '" + category + "'");
            }
        }
        List<KeywordCategory> categories = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : keywordTable.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank()) {
                throw new RoutingRulesException("searchKeywords contains a blank category name");
            }
            List<String> keywords = requireEntries(entry.getValue(), "searchKeywords." + name);
            if (keywords.isEmpty()) {
                throw new RoutingRulesException("searchKeywords." + name + " has no keywords");
            }
            String domainId = categoryDomainMap.get(name);
            Domain domain = domainId == null ? Domain.GENERAL : parseDomain(domainId, "categoryDomainMap." + name);
            categories.add(new KeywordCategory(name, domain, List.copyOf(keywords), TextNormalizer.phrasePattern(keywords)));
        }

        List<String> greetingList = requireEntries(document.simpleGreetings(), "simpleGreetings");
        Set<String> greetings = new LinkedHashSet<>();
        for (String greeting : greetingList) {
            String normalized = TextNormalizer.stripPunctuation(greeting);
            if (!normalized.isEmpty()) {
                greetings.add(normalized);
            }
        }
        if (greetings.isEmpty()) {
            throw new RoutingRulesException("simpleGreetings must not be empty");
        }

        Map<String, String> suffixTable = require(document.domainSuffixes(), "domainSuffixes");
        Map<Domain, String> suffixes = new EnumMap<>(Domain.class);
        for (Map.Entry<String, String> entry : suffixTable.entrySet()) {
            Domain domain = parseDomain(entry.getKey(), "domainSuffixes");
            suffixes.put(domain, entry.getValue() == null ? "" : entry.getValue());
        }

        RoutingRulesDocument.ComplexityPatterns complexity = require(document.complexityPatterns(), "complexityPatterns");
        requireEntries(complexity.high(), "complexityPatterns.high");
        requireEntries(complexity.medium(), "complexityPatterns.medium");
        requireEntries(document.stopWords(), "stopWords");
        requireEntries(document.hindiPatterns(), "hindiPatterns");
        requireEntries(document.recheckPhrases(), "recheckPhrases");
        requireEntries(document.sequelContextKeywords(), "sequelContextKeywords");

        RoutingRulesDocument.IntentKeywords intents = require(document.intentKeywords(), "intentKeywords");
        Map<String, List<String>> noSearchTable = require(intents.noSearch(), "intentKeywords.noSearch");
        Map<UserIntent, Pattern> noSearch = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : noSearchTable.entrySet()) {
            UserIntent intent = parseIntent(entry.getKey());
            noSearch.put(intent, TextNormalizer.phrasePattern(
                    requireEntries(entry.getValue(), "intentKeywords.noSearch." + entry.getKey())));
        }
        requireEntries(intents.news(), "intentKeywords.news");
        requireEntries(intents.local(), "intentKeywords.local");
        requireEntries(intents.shopping(), "intentKeywords.shopping");
        requireEntries(intents.knowledge(), "intentKeywords.knowledge");

        return new RoutingRules(freeze(document), categories, greetings, suffixes, noSearch);
    }

    public RoutingRulesDocument source() {
        return this.source;
    }

    public List<KeywordCategory> categories() {
        return this.categories;
    }

    /**
     * First category, in table order, with a keyword present in the text.
     */
    public Optional<KeywordCategory> matchCategory(String text) {
        for (KeywordCategory category : this.categories) {
            if (category.pattern().matcher(text).find()) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public boolean isGreeting(String normalized) {
        return this.greetings.contains(normalized);
    }

    public Set<String> greetings() {
        return this.greetings;
    }

    public String domainSuffix(Domain domain) {
        String suffix = this.domainSuffixes.get(domain);
        if (suffix == null) {
            suffix = this.domainSuffixes.getOrDefault(Domain.GENERAL, "");
        }
        return suffix;
    }

    public Map<Domain, String> domainSuffixes() {
        return this.domainSuffixes;
    }

    public Pattern complexityHigh() {
        return this.complexityHigh;
    }

    public Pattern complexityMedium() {
        return this.complexityMedium;
    }

    public boolean isStopWord(String word) {
        return this.stopWords.contains(word);
    }

    public Set<String> stopWords() {
        return this.stopWords;
    }

    public Pattern hindiPattern() {
        return this.hindiPattern;
    }

    public Pattern recheckPattern() {
        return this.recheckPattern;
    }

    public Pattern sequelContextPattern() {
        return this.sequelContextPattern;
    }

    public Map<UserIntent, Pattern> noSearchPatterns() {
        return this.noSearchPatterns;
    }

    public Pattern newsPattern() {
        return this.newsPattern;
    }

    public Pattern localPattern() {
        return this.localPattern;
    }

    public Pattern shoppingPattern() {
        return this.shoppingPattern;
    }

    public Pattern knowledgePattern() {
        return this.knowledgePattern;
    }

    public int keywordCount() {
        return this.keywordCount;
    }

    private static <T> T require(T value, String section) {
        if (value == null) {
            throw new RoutingRulesException("Missing section '" + section + "'");
        }
        return value;
    }

    private static List<String> requireEntries(List<String> values, String section) {
        require(values, section);
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new RoutingRulesException("Section '" + section + "' contains a blank entry");
            }
        }
        return values;
    }

    private static Domain parseDomain(String value, String section) {
        try {
            return Domain.fromId(value);
        }
        catch (IllegalArgumentException e) {
            throw new RoutingRulesException("Unknown domain '" + value + "' in " + section, e);
        }
    }

    private static UserIntent parseIntent(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (UserIntent intent : UserIntent.values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        throw new RoutingRulesException("Unknown intent '" + value + "' in intentKeywords.noSearch");
    }

    /**
     * Deep copy of a validated document with every section unmodifiable, so {@link #source()} cannot
     * be used to change the active rules.
     */
    private static RoutingRulesDocument freeze(RoutingRulesDocument document) {
        RoutingRulesDocument.ComplexityPatterns complexity = document.complexityPatterns();
        RoutingRulesDocument.IntentKeywords intents = document.intentKeywords();
        return new RoutingRulesDocument(
                freezeTable(document.searchKeywords()),
                freezeMap(document.categoryDomainMap()),
                List.copyOf(document.simpleGreetings()),
                freezeMap(document.domainSuffixes()),
                new RoutingRulesDocument.ComplexityPatterns(List.copyOf(complexity.high()), List.copyOf(complexity.medium())),
                List.copyOf(document.stopWords()),
                List.copyOf(document.hindiPatterns()),
                List.copyOf(document.recheckPhrases()),
                List.copyOf(document.sequelContextKeywords()),
                new RoutingRulesDocument.IntentKeywords(freezeTable(intents.noSearch()), List.copyOf(intents.news()),
                        List.copyOf(intents.local()), List.copyOf(intents.shopping()), List.copyOf(intents.knowledge())));
    }

    private static Map<String, List<String>> freezeTable(Map<String, List<String>> table) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        table.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    // LinkedHashMap rather than Map.copyOf: order matters and suffix values may be null.
    private static Map<String, String> freezeMap(Map<String, String> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static Set<String> lowercase(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            result.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return result;
    }
}
