package com.example.roomhub.model;

import org.springframework.web.socket.WebSocketSession;

import java.util.Objects;

/** One live connection bound to a display name for its whole lifetime. */
public record Member(WebSocketSession session, String name) {

    public Member {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(name, "name");
    }

    public String sessionId() {
        return session.getId();
    }
}
