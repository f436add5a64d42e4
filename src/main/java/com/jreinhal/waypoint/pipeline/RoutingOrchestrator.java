package com.jreinhal.waypoint.pipeline;

import com.jreinhal.waypoint.classifier.PatternClassifier;
import com.jreinhal.waypoint.config.RoutingProperties;
import com.jreinhal.waypoint.intent.KeywordIntentFallback;
import com.jreinhal.waypoint.intent.SearchIntentClassifier;
import com.jreinhal.waypoint.memory.ConversationMemoryBridge;
import com.jreinhal.waypoint.model.ClassificationResult;
import com.jreinhal.waypoint.model.Complexity;
import com.jreinhal.waypoint.model.Domain;
import com.jreinhal.waypoint.model.IntentSource;
import com.jreinhal.waypoint.model.LastSearchQuery;
import com.jreinhal.waypoint.model.PipelineStage;
import com.jreinhal.waypoint.model.PlanTier;
import com.jreinhal.waypoint.model.RoutingContext;
import com.jreinhal.waypoint.model.RoutingDecision;
import com.jreinhal.waypoint.model.RoutingTier;
import com.jreinhal.waypoint.model.SearchIntentResult;
import com.jreinhal.waypoint.model.SearchType;
import com.jreinhal.waypoint.model.ToneAnalysis;
import com.jreinhal.waypoint.model.UserIntent;
import com.jreinhal.waypoint.rules.RoutingRules;
import com.jreinhal.waypoint.tone.ToneAnalyzer;
import com.jreinhal.waypoint.util.LogSanitizer;
import com.jreinhal.waypoint.util.TextNormalizer;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Decides how one incoming message is handled: whether it needs a live search, which tone to answer
 * in and which processing tier gets it.
 *
 * <p>Stages run in a fixed order. Recheck, greeting and sequel checks are short-circuits: a match
 * returns a complete decision immediately. Otherwise search classification and tone analysis run
 * concurrently on the stage pool, each bounded by {@code stage-timeout-ms} with its own fallback,
 * and their results are merged with the rule-table classification.</p>
 *
 * <p>{@link #route} never throws. Any unexpected failure yields a no-search FAST decision.</p>
 */
@Service
public class RoutingOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RoutingOrchestrator.class);
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_USER_ID = "userId";
    static final int RECHECK_CONFIDENCE = 90;
    static final int GREETING_CONFIDENCE = 95;
    static final int SEQUEL_CONFIDENCE = 80;

    private final PatternClassifier classifier;
    private final SearchIntentClassifier searchClassifier;
    private final KeywordIntentFallback keywordFallback;
    private final ToneAnalyzer toneAnalyzer;
    private final ConversationMemoryBridge memoryBridge;
    private final Executor stageExecutor;
    private final long stageTimeoutMs;
    private final Set<PlanTier> lowTierPlans;

    public RoutingOrchestrator(PatternClassifier classifier, SearchIntentClassifier searchClassifier,
            KeywordIntentFallback keywordFallback, ToneAnalyzer toneAnalyzer, ConversationMemoryBridge memoryBridge,
            @Qualifier("routingStageExecutor") Executor stageExecutor, RoutingProperties properties) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.searchClassifier = Objects.requireNonNull(searchClassifier, "searchClassifier");
        this.keywordFallback = Objects.requireNonNull(keywordFallback, "keywordFallback");
        this.toneAnalyzer = Objects.requireNonNull(toneAnalyzer, "toneAnalyzer");
        this.memoryBridge = Objects.requireNonNull(memoryBridge, "memoryBridge");
        this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor");
        this.stageTimeoutMs = Math.max(1L, properties.getStageTimeoutMs());
        this.lowTierPlans = properties.getLowTierPlans().isEmpty()
                ? EnumSet.noneOf(PlanTier.class) : EnumSet.copyOf(properties.getLowTierPlans());
    }

    public RoutingDecision route(String message, RoutingContext context) {
        Objects.requireNonNull(context, "context");
        long startedNanos = System.nanoTime();
        MDC.put(MDC_REQUEST_ID, context.requestId());
        MDC.put(MDC_USER_ID, context.userId());
        try {
            RoutingDecision decision = this.runPipeline(message == null ? "" : message, context, startedNanos);
            log.info("Routed {} to {} at {} (search={}, type={}, source={}, degraded={}) in {}ms",
                    LogSanitizer.querySummary(message), decision.routedTo(), decision.decidedAt(),
                    decision.searchNeeded(), decision.searchIntent().searchType().id(),
                    decision.searchIntent().source().id(), decision.degraded(), decision.processingTimeMs());
            return decision;
        }
        catch (RuntimeException e) {
            log.error("Routing pipeline failed for {}; falling back to no-search FAST", LogSanitizer.querySummary(message), e);
            return this.safeFallback(message, context, startedNanos);
        }
        finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    RoutingTier decideTier(boolean needsSearch, Complexity complexity, PlanTier planTier) {
        if (needsSearch) {
            return RoutingTier.ENRICHED;
        }
        if (this.lowTierPlans.contains(planTier) || complexity == Complexity.SIMPLE) {
            return RoutingTier.FAST;
        }
        return RoutingTier.ENRICHED;
    }

    private RoutingDecision runPipeline(String message, RoutingContext context, long startedNanos) {
        RoutingRules rules = this.classifier.rules();

        if (this.classifier.isRecheckRequest(message, rules)) {
            Optional<LastSearchQuery> topic = this.memoryBridge.resolveRecheckTopic(context.userId(), rules);
            if (topic.isPresent()) {
                return this.recheckDecision(message, topic.get(), context, rules, startedNanos);
            }
            log.debug("Recheck phrasing without a previous search; classifying normally");
        }
        if (this.classifier.isGreeting(message, rules)) {
            return this.greetingDecision(message, context, rules, startedNanos);
        }
        if (this.classifier.isSequelPattern(message, rules)) {
            return this.sequelDecision(message, context, rules, startedNanos);
        }

        CompletableFuture<StageResult<SearchIntentResult>> searchStage = this.runStage(PipelineStage.SEARCH_CLASSIFY,
                () -> this.searchClassifier.classify(message, context.userId(), rules),
                () -> this.keywordFallback.classify(message, rules, "search stage failed"));
        CompletableFuture<StageResult<ToneAnalysis>> toneStage = this.runStage(PipelineStage.TONE_ANALYZE,
                () -> this.toneAnalyzer.analyze(message, context.userId()),
                () -> this.toneAnalyzer.analyzeStatistical(message));

        ClassificationResult classification = this.classifier.classify(message, rules);
        StageResult<SearchIntentResult> search = searchStage.join();
        StageResult<ToneAnalysis> tone = toneStage.join();

        SearchIntentResult intent = search.value();
        if (intent.needsSearch()) {
            if (intent.suggestedQuery() == null || intent.suggestedQuery().isBlank()) {
                intent = new SearchIntentResult(true, intent.searchType(), intent.intent(),
                        classification.coreText() + rules.domainSuffix(classification.domain()),
                        intent.confidence(), intent.source(), intent.reasoning());
            }
            this.memoryBridge.remember(context.userId(), intent.suggestedQuery(), classification.domain(),
                    intent.searchType());
        }
        RoutingTier tier = this.decideTier(intent.needsSearch(), classification.complexity(), context.planTier());
        return new RoutingDecision(context.requestId(), classification, intent, tone.value(), tier,
                PipelineStage.ROUTE_DECIDE, search.degraded() || tone.degraded(), elapsedMs(startedNanos));
    }

    private RoutingDecision recheckDecision(String message, LastSearchQuery topic, RoutingContext context,
            RoutingRules rules, long startedNanos) {
        SearchType type = topic.searchType() == null || topic.searchType() == SearchType.NONE
                ? SearchType.WEB : topic.searchType();
        Domain domain = topic.domain() == null ? Domain.GENERAL : topic.domain();
        SearchIntentResult intent = SearchIntentResult.search(type, UserIntent.CONTINUATION, topic.query(),
                RECHECK_CONFIDENCE, IntentSource.PATTERN, "Recheck of previous search");
        ClassificationResult classification = new ClassificationResult(
                this.classifier.estimateComplexity(topic.query(), rules), domain, this.classifier.coreText(topic.query(), rules));
        this.memoryBridge.remember(context.userId(), topic.query(), domain, type);
        return new RoutingDecision(context.requestId(), classification, intent,
                this.toneAnalyzer.analyzeStatistical(message), RoutingTier.ENRICHED, PipelineStage.RECHECK_CHECK,
                false, elapsedMs(startedNanos));
    }

    private RoutingDecision greetingDecision(String message, RoutingContext context, RoutingRules rules,
            long startedNanos) {
        UserIntent intent = UserIntent.GREETING;
        String lower = TextNormalizer.collapseWhitespace(message).toLowerCase(Locale.ROOT);
        for (Map.Entry<UserIntent, Pattern> entry : rules.noSearchPatterns().entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                intent = entry.getKey();
                break;
            }
        }
        ClassificationResult classification = new ClassificationResult(Complexity.SIMPLE, Domain.GENERAL,
                this.classifier.coreText(message, rules));
        SearchIntentResult search = SearchIntentResult.noSearch(intent, GREETING_CONFIDENCE, IntentSource.PATTERN,
                "Greeting short-circuit");
        return new RoutingDecision(context.requestId(), classification, search,
                this.toneAnalyzer.analyzeStatistical(message), RoutingTier.FAST, PipelineStage.GREETING_CHECK,
                false, elapsedMs(startedNanos));
    }

    private RoutingDecision sequelDecision(String message, RoutingContext context, RoutingRules rules,
            long startedNanos) {
        String coreText = this.classifier.coreText(message, rules);
        String query = coreText + rules.domainSuffix(Domain.ENTERTAINMENT);
        ClassificationResult classification = new ClassificationResult(
                this.classifier.estimateComplexity(message, rules), Domain.ENTERTAINMENT, coreText);
        SearchIntentResult search = SearchIntentResult.search(SearchType.WEB, UserIntent.ENTERTAINMENT, query,
                SEQUEL_CONFIDENCE, IntentSource.PATTERN, "Title with sequel number");
        this.memoryBridge.remember(context.userId(), query, Domain.ENTERTAINMENT, SearchType.WEB);
        return new RoutingDecision(context.requestId(), classification, search,
                this.toneAnalyzer.analyzeStatistical(message), RoutingTier.ENRICHED,
                PipelineStage.SEQUEL_PATTERN_CHECK, false, elapsedMs(startedNanos));
    }

    /**
     * Runs a stage on the stage pool with the caller's MDC. A failure, rejection or timeout is replaced
     * by the fallback value and flagged as degraded; it never fails the pipeline.
     */
    private <T> CompletableFuture<StageResult<T>> runStage(PipelineStage stage, Supplier<T> work, Supplier<T> fallback) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return work.get();
                }
                finally {
                    MDC.clear();
                }
            }, this.stageExecutor);
        }
        catch (RejectedExecutionException e) {
            log.warn("Stage {} rejected by pool; using fallback", stage);
            return CompletableFuture.completedFuture(new StageResult<T>(fallback.get(), true));
        }
        return future.orTimeout(this.stageTimeoutMs, TimeUnit.MILLISECONDS)
                .handle((value, error) -> {
                    if (error == null && value != null) {
                        return new StageResult<T>(value, false);
                    }
                    log.warn("Stage {} did not complete ({}); using fallback", stage,
                            error == null ? "null result" : rootCause(error).getClass().getSimpleName());
                    return new StageResult<T>(fallback.get(), true);
                });
    }

    private RoutingDecision safeFallback(String message, RoutingContext context, long startedNanos) {
        ClassificationResult classification = new ClassificationResult(Complexity.SIMPLE, Domain.GENERAL,
                TextNormalizer.collapseWhitespace(message));
        SearchIntentResult search = SearchIntentResult.noSearch(UserIntent.UNKNOWN, 0, IntentSource.DEFAULT,
                "Routing pipeline error");
        return new RoutingDecision(context.requestId(), classification, search, ToneAnalysis.neutral(),
                RoutingTier.FAST, PipelineStage.DONE, true, elapsedMs(startedNanos));
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private record StageResult<T>(T value, boolean degraded) {
    }
}
