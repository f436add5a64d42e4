package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DetectedLanguage {
    ENGLISH,
    HINDI,
    HINGLISH,
    MIXED;

    @JsonValue
    public String id() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
