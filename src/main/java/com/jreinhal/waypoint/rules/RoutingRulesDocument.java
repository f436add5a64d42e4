package com.jreinhal.waypoint.rules;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of the hot-reloadable rule tables. Every section is optional on reload: a missing
 * section keeps the active value. {@code searchKeywords} order is significant, since the first
 * matching category wins.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutingRulesDocument(
        Map<String, List<String>> searchKeywords,
        Map<String, String> categoryDomainMap,
        List<String> simpleGreetings,
        Map<String, String> domainSuffixes,
        ComplexityPatterns complexityPatterns,
        List<String> stopWords,
        List<String> hindiPatterns,
        List<String> recheckPhrases,
        List<String> sequelContextKeywords,
        IntentKeywords intentKeywords) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ComplexityPatterns(List<String> high, List<String> medium) {
    }

    /**
     * Keyword fallback tables, consulted in the order no-search, news, local, shopping, knowledge.
     * {@code noSearch} is keyed by intent name so a match also tells which conversational intent it was.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IntentKeywords(
            Map<String, List<String>> noSearch,
            List<String> news,
            List<String> local,
            List<String> shopping,
            List<String> knowledge) {
    }

    public RoutingRulesDocument withSearchKeywords(Map<String, List<String>> table) {
        return new RoutingRulesDocument(table, this.categoryDomainMap, this.simpleGreetings, this.domainSuffixes,
                this.complexityPatterns, this.stopWords, this.hindiPatterns, this.recheckPhrases,
                this.sequelContextKeywords, this.intentKeywords);
    }

    public RoutingRulesDocument withSimpleGreetings(List<String> greetings) {
        return new RoutingRulesDocument(this.searchKeywords, this.categoryDomainMap, greetings, this.domainSuffixes,
                this.complexityPatterns, this.stopWords, this.hindiPatterns, this.recheckPhrases,
                this.sequelContextKeywords, this.intentKeywords);
    }

    /**
     * Returns a copy of {@code base} with every non-null section of {@code patch} laid over it.
     * Nested sections are overlaid field by field.
     */
    public static RoutingRulesDocument overlay(RoutingRulesDocument base, RoutingRulesDocument patch) {
        if (patch == null) {
            return base;
        }
        return new RoutingRulesDocument(
                pick(patch.searchKeywords, base.searchKeywords),
                pick(patch.categoryDomainMap, base.categoryDomainMap),
                pick(patch.simpleGreetings, base.simpleGreetings),
                pick(patch.domainSuffixes, base.domainSuffixes),
                overlay(base.complexityPatterns, patch.complexityPatterns),
                pick(patch.stopWords, base.stopWords),
                pick(patch.hindiPatterns, base.hindiPatterns),
                pick(patch.recheckPhrases, base.recheckPhrases),
                pick(patch.sequelContextKeywords, base.sequelContextKeywords),
                overlay(base.intentKeywords, patch.intentKeywords));
    }

    private static ComplexityPatterns overlay(ComplexityPatterns base, ComplexityPatterns patch) {
        if (patch == null) {
            return base;
        }
        if (base == null) {
            return patch;
        }
        return new ComplexityPatterns(pick(patch.high, base.high), pick(patch.medium, base.medium));
    }

    private static IntentKeywords overlay(IntentKeywords base, IntentKeywords patch) {
        if (patch == null) {
            return base;
        }
        if (base == null) {
            return patch;
        }
        return new IntentKeywords(pick(patch.noSearch, base.noSearch), pick(patch.news, base.news),
                pick(patch.local, base.local), pick(patch.shopping, base.shopping),
                pick(patch.knowledge, base.knowledge));
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
