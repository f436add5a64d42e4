package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum Formality {
    CASUAL,
    SEMI_FORMAL,
    FORMAL;

    @JsonValue
    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Formality> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Formality formality : values()) {
            if (formality.name().equals(normalized)) {
                return Optional.of(formality);
            }
        }
        return Optional.empty();
    }
}
