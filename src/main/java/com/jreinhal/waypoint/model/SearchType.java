package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SearchType {
    LOCAL,
    WEB,
    NEWS,
    SHOPPING,
    KNOWLEDGE,
    NONE;

    @JsonValue
    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when reading model output. Unknown or missing values map to {@link #NONE}.
     */
    public static SearchType fromId(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SearchType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return NONE;
    }
}
