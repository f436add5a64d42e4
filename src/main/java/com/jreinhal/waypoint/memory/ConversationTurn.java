package com.jreinhal.waypoint.memory;

import java.time.Instant;

public record ConversationTurn(Role role, String content, Instant timestamp) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public boolean isUser() {
        return this.role == Role.USER;
    }
}
