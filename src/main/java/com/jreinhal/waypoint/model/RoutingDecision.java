package com.jreinhal.waypoint.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Final output of the routing pipeline, handed to prompt construction and then discarded.
 *
 * @param decidedAt stage that produced the decision: a short-circuit or {@link PipelineStage#ROUTE_DECIDE}
 * @param degraded  true when a stage fell back because of a failure or timeout
 */
public record RoutingDecision(
        String requestId,
        ClassificationResult classification,
        SearchIntentResult searchIntent,
        ToneAnalysis tone,
        RoutingTier routedTo,
        PipelineStage decidedAt,
        boolean degraded,
        long processingTimeMs) {

    @JsonIgnore
    public boolean searchNeeded() {
        return this.searchIntent.needsSearch();
    }

    @JsonIgnore
    public String searchQuery() {
        return this.searchIntent.suggestedQuery();
    }
}
