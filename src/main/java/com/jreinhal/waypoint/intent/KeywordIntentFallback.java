package com.jreinhal.waypoint.intent;

import com.jreinhal.waypoint.model.IntentSource;
import com.jreinhal.waypoint.model.SearchIntentResult;
import com.jreinhal.waypoint.model.SearchType;
import com.jreinhal.waypoint.model.UserIntent;
import com.jreinhal.waypoint.rules.RoutingRules;
import com.jreinhal.waypoint.util.TextNormalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Deterministic search verdict used when the model cannot give one. Checked in priority order:
 * no-search phrases, news, local places, shopping, general knowledge. Nothing matching means
 * no search, which is the cheaper mistake.
 */
@Component
public class KeywordIntentFallback {
    static final int NO_SEARCH_CONFIDENCE = 85;
    static final int NEWS_CONFIDENCE = 70;
    static final int LOCAL_CONFIDENCE = 75;
    static final int SHOPPING_CONFIDENCE = 70;
    static final int KNOWLEDGE_CONFIDENCE = 60;
    static final int DEFAULT_CONFIDENCE = 40;

    public SearchIntentResult classify(String message, RoutingRules rules, String reason) {
        String query = TextNormalizer.collapseWhitespace(message);
        String text = query.toLowerCase(Locale.ROOT);
        for (Map.Entry<UserIntent, Pattern> entry : rules.noSearchPatterns().entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return SearchIntentResult.noSearch(entry.getKey(), NO_SEARCH_CONFIDENCE, IntentSource.KEYWORD_FALLBACK,
                        "Matched " + entry.getKey().id() + " phrase (" + reason + ")");
            }
        }
        if (rules.newsPattern().matcher(text).find()) {
            return SearchIntentResult.search(SearchType.NEWS, UserIntent.FACTUAL_SEARCH, query, NEWS_CONFIDENCE,
                    IntentSource.KEYWORD_FALLBACK, "Matched news keyword (" + reason + ")");
        }
        if (rules.localPattern().matcher(text).find()) {
            return SearchIntentResult.search(SearchType.LOCAL, UserIntent.LOCAL_SEARCH, query, LOCAL_CONFIDENCE,
                    IntentSource.KEYWORD_FALLBACK, "Matched local keyword (" + reason + ")");
        }
        if (rules.shoppingPattern().matcher(text).find()) {
            return SearchIntentResult.search(SearchType.SHOPPING, UserIntent.PRODUCT_SEARCH, query,
                    SHOPPING_CONFIDENCE, IntentSource.KEYWORD_FALLBACK, "Matched shopping keyword (" + reason + ")");
        }
        if (rules.knowledgePattern().matcher(text).find()) {
            return SearchIntentResult.search(SearchType.KNOWLEDGE, UserIntent.QUESTION, query, KNOWLEDGE_CONFIDENCE,
                    IntentSource.KEYWORD_FALLBACK, "Matched knowledge keyword (" + reason + ")");
        }
        return SearchIntentResult.noSearch(UserIntent.UNKNOWN, DEFAULT_CONFIDENCE, IntentSource.DEFAULT,
                "No keyword matched (" + reason + ")");
    }
}
