package com.jreinhal.waypoint.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.waypoint.cache.CacheStats;
import com.jreinhal.waypoint.cache.ExpiringCache;
import com.jreinhal.waypoint.config.RoutingProperties;
import com.jreinhal.waypoint.llm.CompletionOptions;
import com.jreinhal.waypoint.llm.LlmService;
import com.jreinhal.waypoint.llm.parse.LlmJsonParser;
import com.jreinhal.waypoint.llm.parse.ParseAttempt;
import com.jreinhal.waypoint.model.IntentSource;
import com.jreinhal.waypoint.model.SearchIntentResult;
import com.jreinhal.waypoint.model.SearchType;
import com.jreinhal.waypoint.model.UserIntent;
import com.jreinhal.waypoint.rules.RoutingRules;
import com.jreinhal.waypoint.rules.RoutingRulesRegistry;
import com.jreinhal.waypoint.util.LogSanitizer;
import com.jreinhal.waypoint.util.SimpleCircuitBreaker;
import com.jreinhal.waypoint.util.TextNormalizer;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid search-intent classifier.
 *
 * <p>Order of resolution: near-empty input resolves to a default without any model call; then the
 * normalized-text cache; then one model call parsed through {@link LlmJsonParser}; then
 * {@link KeywordIntentFallback} when the call fails, times out, cannot be parsed or comes back
 * below the confidence floor. Every non-trivial result is cached before it is returned.
 * {@link #classify} never throws for classifier-side failures.</p>
 */
@Service
public class SearchIntentClassifier {
    private static final Logger log = LoggerFactory.getLogger(SearchIntentClassifier.class);
    static final int NEAR_EMPTY_CONFIDENCE = 30;
    static final int MISSING_CONFIDENCE_DEFAULT = 70;

    private final LlmService llmService;
    private final ExpiringCache<String, SearchIntentResult> cache;
    private final KeywordIntentFallback fallback;
    private final LlmJsonParser parser;
    private final RoutingRulesRegistry rulesRegistry;
    private final Executor llmExecutor;
    private final RoutingProperties.Intent config;
    private final SimpleCircuitBreaker circuitBreaker;

    public SearchIntentClassifier(LlmService llmService, ExpiringCache<String, SearchIntentResult> searchIntentCache,
            KeywordIntentFallback fallback, LlmJsonParser parser, RoutingRulesRegistry rulesRegistry,
            @Qualifier("routingLlmExecutor") Executor llmExecutor, RoutingProperties properties, Clock clock) {
        this.llmService = Objects.requireNonNull(llmService, "llmService");
        this.cache = Objects.requireNonNull(searchIntentCache, "searchIntentCache");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.rulesRegistry = Objects.requireNonNull(rulesRegistry, "rulesRegistry");
        this.llmExecutor = Objects.requireNonNull(llmExecutor, "llmExecutor");
        this.config = properties.getIntent();
        RoutingProperties.CircuitBreaker breaker = this.config.getCircuitBreaker();
        this.circuitBreaker = breaker.isEnabled()
                ? new SimpleCircuitBreaker("search-intent", breaker.getFailureThreshold(),
                        Duration.ofSeconds(breaker.getOpenSeconds()), breaker.getHalfOpenMaxCalls(), clock)
                : null;
    }

    public SearchIntentResult classify(String message) {
        return this.classify(message, null, this.rulesRegistry.current());
    }

    public SearchIntentResult classify(String message, String userId, RoutingRules rules) {
        String trimmed = message == null ? "" : message.trim();
        if (trimmed.length() < this.config.getMinTextLength()) {
            return SearchIntentResult.noSearch(UserIntent.UNKNOWN, NEAR_EMPTY_CONFIDENCE, IntentSource.DEFAULT,
                    "Message too short to classify");
        }
        String key = this.cacheKey(trimmed);
        Optional<SearchIntentResult> cached = this.cache.get(key);
        if (cached.isPresent()) {
            log.debug("Search intent cache hit for {}", LogSanitizer.querySummary(trimmed));
            return cached.get().withSource(IntentSource.CACHE);
        }
        SearchIntentResult result = this.classifyUncached(trimmed, userId, rules);
        this.cache.set(key, result);
        log.info("Search intent {}: intent={}, needsSearch={}, type={}, confidence={}, source={}",
                LogSanitizer.querySummary(trimmed), result.intent().id(), result.needsSearch(),
                result.searchType().id(), result.confidence(), result.source().id());
        return result;
    }

    public CacheStats cacheStats() {
        return this.cache.stats();
    }

    public void clearCache() {
        this.cache.clear();
    }

    public Optional<SimpleCircuitBreaker.State> circuitState() {
        return Optional.ofNullable(this.circuitBreaker).map(SimpleCircuitBreaker::getState);
    }

    String cacheKey(String message) {
        String normalized = TextNormalizer.collapseWhitespace(message).toLowerCase(Locale.ROOT);
        int max = Math.max(1, this.config.getCacheKeyMaxLength());
        return normalized.length() <= max ? normalized : normalized.substring(0, max);
    }

    private SearchIntentResult classifyUncached(String message, String userId, RoutingRules rules) {
        if (!this.config.isLlmEnabled()) {
            return this.fallback.classify(message, rules, "model disabled");
        }
        if (this.circuitBreaker != null && !this.circuitBreaker.allowRequest()) {
            log.warn("Search intent circuit open; using keyword fallback");
            return this.fallback.classify(message, rules, "circuit open");
        }
        long timeoutMs = this.config.getLlmTimeoutMs();
        String prompt = SearchIntentPrompt.render(message);
        CompletionOptions options = new CompletionOptions(this.config.getMaxTokens(), this.config.getTemperature(),
                timeoutMs, userId);
        FutureTask<String> future = new FutureTask<>(() -> this.llmService.generateCompletion(prompt, options));
        String response;
        try {
            // FutureTask, unlike CompletableFuture, interrupts the model call when cancelled.
            this.llmExecutor.execute(future);
            response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            this.recordFailure(e);
            log.warn("Search intent model call timed out after {}ms", timeoutMs);
            return this.fallback.classify(message, rules, "model timeout");
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Search intent model call interrupted");
            return this.fallback.classify(message, rules, "interrupted");
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            this.recordFailure(cause);
            log.warn("Search intent model call failed: {}", LogSanitizer.sanitize(cause.getMessage()));
            return this.fallback.classify(message, rules, "model error");
        }
        catch (RejectedExecutionException e) {
            log.warn("Search intent model call skipped, model pool saturated");
            return this.fallback.classify(message, rules, "model pool saturated");
        }
        if (this.circuitBreaker != null) {
            this.circuitBreaker.recordSuccess();
        }

        ParseAttempt attempt = this.parser.parse(response, SearchIntentClassifier::isIntentVerdict);
        if (!attempt.succeeded()) {
            log.warn("Search intent model output unparseable ({}); using keyword fallback",
                    LogSanitizer.preview(attempt.error(), 200));
            return this.fallback.classify(message, rules, "unparseable model output");
        }
        SearchIntentResult verdict = toResult(attempt.value(), message);
        if (verdict.confidence() < this.config.getMinLlmConfidence()) {
            log.info("Search intent model confidence {} below floor {}; using keyword fallback",
                    verdict.confidence(), this.config.getMinLlmConfidence());
            return this.fallback.classify(message, rules, "low model confidence");
        }
        return verdict;
    }

    private void recordFailure(Throwable error) {
        if (this.circuitBreaker != null) {
            this.circuitBreaker.recordFailure(error);
        }
    }

    static boolean isIntentVerdict(JsonNode node) {
        JsonNode needsSearch = node.get("needsSearch");
        JsonNode intent = node.get("intent");
        boolean hasDecision = needsSearch != null && (needsSearch.isBoolean() || needsSearch.isTextual());
        boolean hasIntent = intent != null && intent.isTextual();
        return hasDecision || hasIntent;
    }

    static SearchIntentResult toResult(JsonNode node, String message) {
        UserIntent intent = UserIntent.fromId(textOrNull(node.get("intent")));
        JsonNode needsNode = node.get("needsSearch");
        boolean needsSearch = needsNode != null && needsNode.asBoolean(false);
        SearchType searchType = SearchType.fromId(textOrNull(node.get("searchType")));
        String query = textOrNull(node.get("suggestedQuery"));
        if (needsSearch && (query == null || query.isBlank())) {
            query = TextNormalizer.collapseWhitespace(message);
        }
        String reasoning = textOrNull(node.get("reasoning"));
        return new SearchIntentResult(needsSearch, searchType, intent, query == null ? null : query.trim(),
                confidenceOf(node.get("confidence")), IntentSource.LLM,
                reasoning == null || reasoning.isBlank() ? "No reasoning provided" : reasoning);
    }

    private static int confidenceOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return MISSING_CONFIDENCE_DEFAULT;
        }
        if (node.isNumber()) {
            return (int) Math.round(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                return (int) Math.round(Double.parseDouble(node.asText().replace("%", "").trim()));
            }
            catch (NumberFormatException e) {
                return MISSING_CONFIDENCE_DEFAULT;
            }
        }
        return MISSING_CONFIDENCE_DEFAULT;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
