package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Which path produced a {@link SearchIntentResult}.
 */
public enum IntentSource {
    LLM,
    KEYWORD_FALLBACK,
    CACHE,
    DEFAULT,
    /** Produced by one of the pipeline short-circuit rules (recheck, greeting, sequel). */
    PATTERN;

    @JsonValue
    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
