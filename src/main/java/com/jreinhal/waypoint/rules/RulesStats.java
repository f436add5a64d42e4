package com.jreinhal.waypoint.rules;

import java.time.Instant;

public record RulesStats(int categories, int keywords, int greetings, int domainSuffixes, int stopWords,
        Instant lastUpdated) {
}
