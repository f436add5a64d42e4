package com.jreinhal.waypoint.model;

public enum RoutingTier {
    /** Cheap path with no external context. */
    FAST,
    /** Search-augmented path. */
    ENRICHED
}
