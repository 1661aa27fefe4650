package com.example.roomhub.activity;

import java.util.Map;

/**
 * Lifecycle and messaging contract of a room activity.
 * Implementations are driven by RoomService while it holds the room monitor, except {@link #stop()}.
 */
public interface Activity {

    ActivityType type();

    void start();

    /**
     * Cancels the background loop and waits for it to terminate.
     * Callers must not hold the room monitor, otherwise the wait is skipped.
     */
    void stop();

    boolean isRunning();

    /**
     * Handles {@code activity:<type>:<action>}. Never throws for client mistakes;
     * rejected actions come back as {@code {type:"error", message}}.
     */
    Map<String, Object> handleAction(String identity, String action, Map<String, Object> payload);

    /** Per-member projection ({@code activity_state}) sent on join and after state changes. */
    Map<String, Object> snapshotFor(String identity);

    void addMember(String identity);

    void removeMember(String identity);
}
