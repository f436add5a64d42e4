package com.jreinhal.waypoint.model;

public enum PipelineStage {
    START,
    RECHECK_CHECK,
    GREETING_CHECK,
    SEQUEL_PATTERN_CHECK,
    SEARCH_CLASSIFY,
    TONE_ANALYZE,
    DOMAIN_COMPLEXITY_MERGE,
    ROUTE_DECIDE,
    DONE
}
