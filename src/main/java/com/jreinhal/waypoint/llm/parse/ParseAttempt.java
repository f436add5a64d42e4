package com.jreinhal.waypoint.llm.parse;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one parse strategy: either a JSON object or the reason it could not produce one.
 */
public record ParseAttempt(String strategy, JsonNode value, String error) {

    public static ParseAttempt success(String strategy, JsonNode value) {
        return new ParseAttempt(strategy, value, null);
    }

    public static ParseAttempt failure(String strategy, String error) {
        return new ParseAttempt(strategy, null, error == null ? "unknown" : error);
    }

    public boolean succeeded() {
        return this.value != null;
    }
}
