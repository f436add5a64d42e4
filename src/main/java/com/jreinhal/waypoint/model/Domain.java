package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Coarse subject area of a message. Drives the search-query suffix appended when a
 * query is sent to an external search provider.
 */
public enum Domain {
    GENERAL,
    ENTERTAINMENT,
    LOCAL,
    FINANCE,
    TECH,
    TRAVEL,
    HEALTH,
    SHOPPING,
    EDUCATION;

    @JsonValue
    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Domain fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Domain must not be blank");
        }
        return Domain.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
