package com.jreinhal.waypoint.classifier;

import com.jreinhal.waypoint.config.RoutingProperties;
import com.jreinhal.waypoint.model.ClassificationResult;
import com.jreinhal.waypoint.model.Complexity;
import com.jreinhal.waypoint.model.DetectedLanguage;
import com.jreinhal.waypoint.model.Domain;
import com.jreinhal.waypoint.rules.RoutingRules;
import com.jreinhal.waypoint.rules.RoutingRulesRegistry;
import com.jreinhal.waypoint.util.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Table-driven classification with no I/O. Each method has an overload taking an explicit
 * {@link RoutingRules} snapshot so one request sees one consistent set of tables even if the
 * rules are reloaded mid-flight.
 */
@Component
public class PatternClassifier {
    // "<word> 2", "<word> part 3", "<word> 2nd", "<word> iii", "<word> second"; three-digit numbers never count.
    private static final Pattern SEQUEL_NUMBER = Pattern.compile(
            "(?<![\\p{L}\\p{N}])\\p{L}{2,}\\s+(?:part\\s+)?"
            + "(?:\\d{1,2}(?:st|nd|rd|th)?|ii|iii|iv|v|vi|vii|viii|ix|x|second|third|fourth|fifth|sixth)"
            + "(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern DEVANAGARI = Pattern.compile("[\\u0900-\\u097F]");

    private final RoutingRulesRegistry registry;
    private final int greetingMaxWords;
    private final int mediumWordThreshold;

    public PatternClassifier(RoutingRulesRegistry registry, RoutingProperties properties) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.greetingMaxWords = Math.max(1, properties.getGreetingMaxWords());
        this.mediumWordThreshold = Math.max(1, properties.getMediumWordThreshold());
    }

    public RoutingRules rules() {
        return this.registry.current();
    }

    public ClassificationResult classify(String message) {
        return this.classify(message, this.rules());
    }

    public ClassificationResult classify(String message, RoutingRules rules) {
        return new ClassificationResult(this.estimateComplexity(message, rules), this.detectDomain(message, rules),
                this.coreText(message, rules));
    }

    public boolean isGreeting(String message) {
        return this.isGreeting(message, this.rules());
    }

    /**
     * Exact match on the punctuation-stripped message. Short inputs may also match on their first
     * token ("hi there") as long as the rest names no search keyword: "hey ipl score" is a question.
     * Never a substring match: "hi-tech" is not a greeting.
     */
    public boolean isGreeting(String message, RoutingRules rules) {
        String normalized = TextNormalizer.stripPunctuation(message);
        if (normalized.isEmpty()) {
            return false;
        }
        if (rules.isGreeting(normalized)) {
            return true;
        }
        List<String> words = TextNormalizer.words(normalized);
        if (words.size() > this.greetingMaxWords || !rules.isGreeting(words.get(0))) {
            return false;
        }
        String rest = String.join(" ", words.subList(1, words.size()));
        return rest.isEmpty() || rules.matchCategory(rest).isEmpty();
    }

    public Complexity estimateComplexity(String message) {
        return this.estimateComplexity(message, this.rules());
    }

    public Complexity estimateComplexity(String message, RoutingRules rules) {
        String text = lower(message);
        if (rules.complexityHigh().matcher(text).find()) {
            return Complexity.HIGH;
        }
        if (rules.complexityMedium().matcher(text).find() || TextNormalizer.wordCount(text) > this.mediumWordThreshold) {
            return Complexity.MEDIUM;
        }
        return Complexity.SIMPLE;
    }

    public Domain detectDomain(String message) {
        return this.detectDomain(message, this.rules());
    }

    public Domain detectDomain(String message, RoutingRules rules) {
        return this.matchCategory(message, rules).map(RoutingRules.KeywordCategory::domain).orElse(Domain.GENERAL);
    }

    /**
     * First keyword category, in table order, that the message mentions.
     */
    public Optional<RoutingRules.KeywordCategory> matchCategory(String message, RoutingRules rules) {
        return rules.matchCategory(lower(message));
    }

    public String coreText(String message, RoutingRules rules) {
        List<String> kept = new ArrayList<>();
        for (String word : TextNormalizer.words(TextNormalizer.stripPunctuation(message))) {
            if (!rules.isStopWord(word)) {
                kept.add(word);
            }
        }
        if (kept.isEmpty()) {
            return TextNormalizer.collapseWhitespace(message);
        }
        return String.join(" ", kept);
    }

    public DetectedLanguage detectLanguageFamily(String message) {
        return this.detectLanguageFamily(message, this.rules());
    }

    /**
     * Romanized Hindi function words or Devanagari script mean the message is not plain English.
     */
    public DetectedLanguage detectLanguageFamily(String message, RoutingRules rules) {
        String text = lower(message);
        if (DEVANAGARI.matcher(text).find() || rules.hindiPattern().matcher(text).find()) {
            return DetectedLanguage.HINGLISH;
        }
        return DetectedLanguage.ENGLISH;
    }

    public boolean isSequelPattern(String message) {
        return this.isSequelPattern(message, this.rules());
    }

    /**
     * Requires both a "name followed by a number or ordinal" and a media or venue keyword, so ordinary
     * numbers ("room 204", "table 4") never qualify.
     */
    public boolean isSequelPattern(String message, RoutingRules rules) {
        String text = lower(message);
        return SEQUEL_NUMBER.matcher(text).find() && rules.sequelContextPattern().matcher(text).find();
    }

    public boolean isRecheckRequest(String message) {
        return this.isRecheckRequest(message, this.rules());
    }

    public boolean isRecheckRequest(String message, RoutingRules rules) {
        return rules.recheckPattern().matcher(lower(message)).find();
    }

    private static String lower(String message) {
        return TextNormalizer.collapseWhitespace(message).toLowerCase(Locale.ROOT);
    }
}
