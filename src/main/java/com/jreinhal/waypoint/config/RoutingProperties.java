package com.jreinhal.waypoint.config;

import com.jreinhal.waypoint.model.PlanTier;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "waypoint.routing")
public class RoutingProperties {
    /**
     * Location of the rule-table document loaded at startup and by {@code resetToDefaults}.
     */
    private String rulesLocation = "classpath:waypoint/routing-rules.json";

    /**
     * Plans that route non-search messages to the FAST tier regardless of complexity.
     */
    private Set<PlanTier> lowTierPlans = EnumSet.of(PlanTier.STARTER);

    /**
     * Inputs with at most this many words may match a greeting on their first token alone.
     */
    private int greetingMaxWords = 3;

    /**
     * Messages longer than this many words are at least MEDIUM complexity.
     */
    private int mediumWordThreshold = 15;

    /**
     * Upper bound on the wait for the concurrent search and tone stages.
     * Should exceed both LLM timeouts so each stage gets to run its own fallback.
     */
    private long stageTimeoutMs = 3500;

    /**
     * Number of prior turns requested from the memory store when recovering a recheck topic.
     */
    private int memoryContextLimit = 10;

    private final Cache cache = new Cache();
    private final Intent intent = new Intent();
    private final Tone tone = new Tone();
    private final Executor executor = new Executor();

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public Set<PlanTier> getLowTierPlans() {
        return lowTierPlans;
    }

    public void setLowTierPlans(Set<PlanTier> lowTierPlans) {
        this.lowTierPlans = lowTierPlans == null || lowTierPlans.isEmpty()
                ? EnumSet.noneOf(PlanTier.class) : EnumSet.copyOf(lowTierPlans);
    }

    public int getGreetingMaxWords() {
        return greetingMaxWords;
    }

    public void setGreetingMaxWords(int greetingMaxWords) {
        this.greetingMaxWords = greetingMaxWords;
    }

    public int getMediumWordThreshold() {
        return mediumWordThreshold;
    }

    public void setMediumWordThreshold(int mediumWordThreshold) {
        this.mediumWordThreshold = mediumWordThreshold;
    }

    public long getStageTimeoutMs() {
        return stageTimeoutMs;
    }

    public void setStageTimeoutMs(long stageTimeoutMs) {
        this.stageTimeoutMs = stageTimeoutMs;
    }

    public int getMemoryContextLimit() {
        return memoryContextLimit;
    }

    public void setMemoryContextLimit(int memoryContextLimit) {
        this.memoryContextLimit = memoryContextLimit;
    }

    public Cache getCache() {
        return cache;
    }

    public Intent getIntent() {
        return intent;
    }

    public Tone getTone() {
        return tone;
    }

    public Executor getExecutor() {
        return executor;
    }

    public static class Cache {
        private Duration searchIntentTtl = Duration.ofMinutes(10);
        private int searchIntentMaxEntries = 1000;
        private Duration toneTtl = Duration.ofMinutes(15);
        private int toneMaxEntries = 500;
        /**
         * A cached tone analysis is recomputed after serving this many messages, even inside its TTL.
         */
        private int toneRefreshAfterMessages = 10;
        /**
         * Recheck memory lives for hours since users come back to a topic later.
         */
        private Duration lastSearchTtl = Duration.ofHours(6);
        private int lastSearchMaxEntries = 5000;
        private long sweepIntervalMs = 60000;

        public Duration getSearchIntentTtl() {
            return searchIntentTtl;
        }

        public void setSearchIntentTtl(Duration searchIntentTtl) {
            this.searchIntentTtl = searchIntentTtl;
        }

        public int getSearchIntentMaxEntries() {
            return searchIntentMaxEntries;
        }

        public void setSearchIntentMaxEntries(int searchIntentMaxEntries) {
            this.searchIntentMaxEntries = searchIntentMaxEntries;
        }

        public Duration getToneTtl() {
            return toneTtl;
        }

        public void setToneTtl(Duration toneTtl) {
            this.toneTtl = toneTtl;
        }

        public int getToneMaxEntries() {
            return toneMaxEntries;
        }

        public void setToneMaxEntries(int toneMaxEntries) {
            this.toneMaxEntries = toneMaxEntries;
        }

        public int getToneRefreshAfterMessages() {
            return toneRefreshAfterMessages;
        }

        public void setToneRefreshAfterMessages(int toneRefreshAfterMessages) {
            this.toneRefreshAfterMessages = toneRefreshAfterMessages;
        }

        public Duration getLastSearchTtl() {
            return lastSearchTtl;
        }

        public void setLastSearchTtl(Duration lastSearchTtl) {
            this.lastSearchTtl = lastSearchTtl;
        }

        public int getLastSearchMaxEntries() {
            return lastSearchMaxEntries;
        }

        public void setLastSearchMaxEntries(int lastSearchMaxEntries) {
            this.lastSearchMaxEntries = lastSearchMaxEntries;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }

    public static class Intent {
        private boolean llmEnabled = true;
        private long llmTimeoutMs = 3000;
        private int maxTokens = 200;
        private double temperature = 0.1;
        /**
         * Model verdicts below this confidence are replaced by the keyword fallback.
         */
        private int minLlmConfidence = 40;
        /**
         * Messages shorter than this (after trimming) never reach the model.
         */
        private int minTextLength = 2;
        private int cacheKeyMaxLength = 200;
        private final CircuitBreaker circuitBreaker = new CircuitBreaker();

        public boolean isLlmEnabled() {
            return llmEnabled;
        }

        public void setLlmEnabled(boolean llmEnabled) {
            this.llmEnabled = llmEnabled;
        }

        public long getLlmTimeoutMs() {
            return llmTimeoutMs;
        }

        public void setLlmTimeoutMs(long llmTimeoutMs) {
            this.llmTimeoutMs = llmTimeoutMs;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMinLlmConfidence() {
            return minLlmConfidence;
        }

        public void setMinLlmConfidence(int minLlmConfidence) {
            this.minLlmConfidence = minLlmConfidence;
        }

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public int getCacheKeyMaxLength() {
            return cacheKeyMaxLength;
        }

        public void setCacheKeyMaxLength(int cacheKeyMaxLength) {
            this.cacheKeyMaxLength = cacheKeyMaxLength;
        }

        public CircuitBreaker getCircuitBreaker() {
            return circuitBreaker;
        }
    }

    public static class CircuitBreaker {
        private boolean enabled = true;
        private int failureThreshold = 3;
        private long openSeconds = 30;
        private int halfOpenMaxCalls = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getOpenSeconds() {
            return openSeconds;
        }

        public void setOpenSeconds(long openSeconds) {
            this.openSeconds = openSeconds;
        }

        public int getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }
    }

    public static class Tone {
        private boolean llmRefinementEnabled = true;
        private long llmTimeoutMs = 2000;
        /**
         * Shorter messages skip model refinement and keep the statistical formality.
         */
        private int minLengthForLlm = 10;
        private int maxTokens = 10;
        private int matchConfidenceThreshold = 70;

        public boolean isLlmRefinementEnabled() {
            return llmRefinementEnabled;
        }

        public void setLlmRefinementEnabled(boolean llmRefinementEnabled) {
            this.llmRefinementEnabled = llmRefinementEnabled;
        }

        public long getLlmTimeoutMs() {
            return llmTimeoutMs;
        }

        public void setLlmTimeoutMs(long llmTimeoutMs) {
            this.llmTimeoutMs = llmTimeoutMs;
        }

        public int getMinLengthForLlm() {
            return minLengthForLlm;
        }

        public void setMinLengthForLlm(int minLengthForLlm) {
            this.minLengthForLlm = minLengthForLlm;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getMatchConfidenceThreshold() {
            return matchConfidenceThreshold;
        }

        public void setMatchConfidenceThreshold(int matchConfidenceThreshold) {
            this.matchConfidenceThreshold = matchConfidenceThreshold;
        }
    }

    public static class Executor {
        private int stageCoreThreads = 4;
        private int stageMaxThreads = 8;
        private int stageQueueCapacity = 200;
        private int llmCoreThreads = 4;
        private int llmMaxThreads = 16;
        private int llmQueueCapacity = 200;

        public int getStageCoreThreads() {
            return stageCoreThreads;
        }

        public void setStageCoreThreads(int stageCoreThreads) {
            this.stageCoreThreads = stageCoreThreads;
        }

        public int getStageMaxThreads() {
            return stageMaxThreads;
        }

        public void setStageMaxThreads(int stageMaxThreads) {
            this.stageMaxThreads = stageMaxThreads;
        }

        public int getStageQueueCapacity() {
            return stageQueueCapacity;
        }

        public void setStageQueueCapacity(int stageQueueCapacity) {
            this.stageQueueCapacity = stageQueueCapacity;
        }

        public int getLlmCoreThreads() {
            return llmCoreThreads;
        }

        public void setLlmCoreThreads(int llmCoreThreads) {
            this.llmCoreThreads = llmCoreThreads;
        }

        public int getLlmMaxThreads() {
            return llmMaxThreads;
        }

        public void setLlmMaxThreads(int llmMaxThreads) {
            this.llmMaxThreads = llmMaxThreads;
        }

        public int getLlmQueueCapacity() {
            return llmQueueCapacity;
        }

        public void setLlmQueueCapacity(int llmQueueCapacity) {
            this.llmQueueCapacity = llmQueueCapacity;
        }
    }
}
