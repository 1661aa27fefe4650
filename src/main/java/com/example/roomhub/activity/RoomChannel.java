package com.example.roomhub.activity;

import java.util.Map;

/**
 * Delivery capability of one room, handed to its activity at construction.
 * All activity state mutation happens while holding {@link #mutex()}.
 */
public interface RoomChannel {

    String roomId();

    /** The room-wide monitor; shared by action dispatch and background loops. */
    Object mutex();

    /** Deliver to every member except connections bound to {@code excludeIdentity} (nullable). */
    void broadcast(Map<String, Object> message, String excludeIdentity);

    /** Deliver to the connection bound to {@code identity}; no-op if absent. */
    void sendTo(String identity, Map<String, Object> message);
}
