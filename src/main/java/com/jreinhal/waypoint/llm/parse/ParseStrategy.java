package com.jreinhal.waypoint.llm.parse;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One way of pulling a JSON object out of raw model output. Implementations are pure: no state,
 * no logging, never throw.
 */
public interface ParseStrategy {

    String name();

    ParseAttempt attempt(String raw, ObjectMapper objectMapper);
}
