package com.example.roomhub.activity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Catalog of activity variants a room can run. */
public enum ActivityType {

    YOUTUBE("youtube", "📺 Watch Together", "Synchronized video watching experience"),
    SNAKE("snake", "🐍 Snake Game", "Multiplayer snake game with real-time action"),
    CHAT("chat", "💬 Chat", "Plain room chat without shared state");

    private final String wireName;
    private final String displayName;
    private final String description;

    ActivityType(String wireName, String displayName, String description) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.description = description;
    }

    public String wireName() { return wireName; }
    public String displayName() { return displayName; }
    public String description() { return description; }

    public static Optional<ActivityType> fromWire(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (ActivityType t : values()) {
            if (t.wireName.equals(s)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** Entry for the {@code available_activities} list. */
    public Map<String, Object> describe() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", wireName);
        m.put("name", displayName);
        m.put("description", description);
        return m;
    }
}
