package com.jreinhal.waypoint.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Per-request session details carried through the pipeline.
 */
public record RoutingContext(String requestId, String userId, String sessionId, PlanTier planTier) {

    public RoutingContext {
        Objects.requireNonNull(userId, "userId");
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        planTier = planTier == null ? PlanTier.STARTER : planTier;
    }

    public static RoutingContext of(String userId, PlanTier planTier) {
        return new RoutingContext(null, userId, null, planTier);
    }
}
