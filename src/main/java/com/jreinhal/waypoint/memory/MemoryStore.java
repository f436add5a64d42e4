package com.jreinhal.waypoint.memory;

import java.util.List;

/**
 * Durable conversation history owned by another component. Optional: when no bean is present,
 * recheck requests rely on the in-memory bridge alone.
 */
public interface MemoryStore {

    /**
     * Most recent turns for the user, oldest first, at most {@code limit} of them.
     */
    List<ConversationTurn> getRecentContext(String userId, int limit);
}
