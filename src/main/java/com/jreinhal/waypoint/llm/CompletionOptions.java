package com.jreinhal.waypoint.llm;

/**
 * Per-call generation limits.
 *
 * @param timeoutMs advisory; callers also bound the call themselves
 * @param userId    may be null for calls not tied to a user
 */
public record CompletionOptions(int maxTokens, double temperature, long timeoutMs, String userId) {

    public CompletionOptions {
        maxTokens = Math.max(1, maxTokens);
        temperature = Math.max(0.0, temperature);
        timeoutMs = Math.max(1L, timeoutMs);
    }
}
