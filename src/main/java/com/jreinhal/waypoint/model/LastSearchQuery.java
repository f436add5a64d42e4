package com.jreinhal.waypoint.model;

import java.time.Instant;

/**
 * The most recent search-worthy query for one user, kept so a "check again" can repeat it.
 */
public record LastSearchQuery(String query, Domain domain, SearchType searchType, Instant timestamp) {
}
