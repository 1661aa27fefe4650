package com.example.roomhub.activity;

import com.example.roomhub.activity.chat.ChatActivity;
import com.example.roomhub.activity.snake.SnakeActivity;
import com.example.roomhub.activity.sync.SyncActivity;
import com.example.roomhub.config.ActivityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.*;

/**
 * Factory for activities. New activities are returned unstarted; the caller starts them
 * once they are wired into their room.
 */
@Component
public class ActivityRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActivityRegistry.class);

    private final ActivityProperties properties;
    private final Clock clock;
    private final Random random;

    /** Default constructor for tests. */
    public ActivityRegistry() {
        this(ActivityProperties.defaults(), Clock.systemUTC(), new SecureRandom());
    }

    @Autowired
    public ActivityRegistry(ActivityProperties properties, Clock activityClock) {
        this(properties, activityClock, new SecureRandom());
    }

    public ActivityRegistry(ActivityProperties properties, Clock clock, Random random) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    public Activity create(ActivityType type, RoomChannel channel, Map<String, Object> config) {
        Map<String, Object> cfg = (config == null) ? Map.of() : config;
        long stopTimeout = properties.stopTimeoutMs();
        log.debug("Creating activity type={} room={} config={}", type.wireName(), channel.roomId(), cfg);

        return switch (type) {
            case YOUTUBE -> new SyncActivity(channel, clock, stopTimeout, properties.sync(), cfg);
            case SNAKE -> new SnakeActivity(channel, clock, stopTimeout, snakeSettings(cfg), random);
            case CHAT -> new ChatActivity(channel, clock, stopTimeout);
        };
    }

    /** Activity type for freshly created rooms; falls back to youtube when misconfigured. */
    public ActivityType defaultType() {
        return ActivityType.fromWire(properties.defaultType()).orElseGet(() -> {
            log.warn("Unknown activities.default-type '{}', using youtube", properties.defaultType());
            return ActivityType.YOUTUBE;
        });
    }

    public List<Map<String, Object>> availableActivities() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ActivityType t : ActivityType.values()) out.add(t.describe());
        return out;
    }

    /** Per-game overrides from a change_activity config, clamped to sane bounds. */
    ActivityProperties.Snake snakeSettings(Map<String, Object> cfg) {
        ActivityProperties.Snake base = properties.snake();
        return new ActivityProperties.Snake(
                intOption(cfg, "grid_width", base.gridWidth(), 5, 200),
                intOption(cfg, "grid_height", base.gridHeight(), 5, 200),
                intOption(cfg, "tick_rate", base.tickRate(), 1, 60),
                intOption(cfg, "max_players", base.maxPlayers(), 1, 32),
                base.initialFood(),
                base.spawnInset(),
                base.foodAttempts());
    }

    private static int intOption(Map<String, Object> cfg, String key, int fallback, int min, int max) {
        Double v = Messages.number(cfg, key);
        if (v == null) return fallback;
        long rounded = Math.round(v);
        return (int) Math.max(min, Math.min(max, rounded));
    }
}
