package com.jreinhal.waypoint.model;

/**
 * Verdict on whether a message needs live external information.
 *
 * <p>When {@code needsSearch} is false the search type is always {@link SearchType#NONE}
 * and there is no suggested query.</p>
 */
public record SearchIntentResult(
        boolean needsSearch,
        SearchType searchType,
        UserIntent intent,
        String suggestedQuery,
        int confidence,
        IntentSource source,
        String reasoning) {

    public SearchIntentResult {
        confidence = Math.max(0, Math.min(100, confidence));
        intent = intent == null ? UserIntent.UNKNOWN : intent;
        source = source == null ? IntentSource.DEFAULT : source;
        reasoning = reasoning == null ? "" : reasoning;
        if (!needsSearch) {
            searchType = SearchType.NONE;
            suggestedQuery = null;
        } else if (searchType == null || searchType == SearchType.NONE) {
            searchType = SearchType.WEB;
        }
    }

    public static SearchIntentResult noSearch(UserIntent intent, int confidence, IntentSource source, String reasoning) {
        return new SearchIntentResult(false, SearchType.NONE, intent, null, confidence, source, reasoning);
    }

    public static SearchIntentResult search(SearchType searchType, UserIntent intent, String query, int confidence,
            IntentSource source, String reasoning) {
        return new SearchIntentResult(true, searchType, intent, query, confidence, source, reasoning);
    }

    public SearchIntentResult withSource(IntentSource newSource) {
        return new SearchIntentResult(this.needsSearch, this.searchType, this.intent, this.suggestedQuery,
                this.confidence, newSource, this.reasoning);
    }
}
