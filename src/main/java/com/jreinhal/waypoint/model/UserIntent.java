package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum UserIntent {
    QUESTION,
    LOCAL_SEARCH,
    PRODUCT_SEARCH,
    FACTUAL_SEARCH,
    ENTERTAINMENT,
    COMPLIMENT,
    GREETING,
    FAREWELL,
    GRATITUDE,
    AGREEMENT,
    DISAGREEMENT,
    FRUSTRATION,
    CASUAL_CHAT,
    COMMAND,
    CLARIFICATION,
    CONTINUATION,
    CREATIVE_REQUEST,
    UNKNOWN;

    @JsonValue
    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    public static UserIntent fromId(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (UserIntent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
