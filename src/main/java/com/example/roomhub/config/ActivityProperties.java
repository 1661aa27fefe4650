package com.example.roomhub.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/** Tunables for every activity type, bound from {@code activities.*}. */
@Validated
@ConfigurationProperties(prefix = "activities")
public record ActivityProperties(
        @DefaultValue("youtube") @NotBlank String defaultType,
        @DefaultValue("2000") @Positive long stopTimeoutMs,
        @DefaultValue @Valid Sync sync,
        @DefaultValue @Valid Snake snake) {

    public static ActivityProperties defaults() {
        return new ActivityProperties("youtube", 2000L, Sync.defaults(), Snake.defaults());
    }

    /** Synchronized video: drift loop, buffering grace and per-action cooldowns (seconds). */
    public static record Sync(
            @DefaultValue("2000") @Positive long driftIntervalMs,
            @DefaultValue("5000") @Positive long staleStateMs,
            @DefaultValue("500") @PositiveOrZero long bufferGraceMs,
            @DefaultValue("2.0") @Positive double maxPlaybackRate,
            Map<String, Double> throttleSeconds) {

        public static final Map<String, Double> DEFAULT_THROTTLES = Map.of(
                "load_video", 3.0,
                "seek", 1.0,
                "set_rate", 1.0,
                "play", 0.5,
                "pause", 0.5,
                "sync_request", 1.0,
                "request_master", 2.0);

        public Sync {
            throttleSeconds = (throttleSeconds == null || throttleSeconds.isEmpty())
                    ? DEFAULT_THROTTLES
                    : Map.copyOf(throttleSeconds);
        }

        public static Sync defaults() {
            return new Sync(2000L, 5000L, 500L, 2.0, null);
        }
    }

    /** Snake game defaults; a change_activity config may override grid, tick rate and capacity. */
    public static record Snake(
            @DefaultValue("20") @Min(5) @Max(200) int gridWidth,
            @DefaultValue("20") @Min(5) @Max(200) int gridHeight,
            @DefaultValue("10") @Min(1) @Max(60) int tickRate,
            @DefaultValue("8") @Min(1) @Max(32) int maxPlayers,
            @DefaultValue("3") @PositiveOrZero int initialFood,
            @DefaultValue("2") @PositiveOrZero int spawnInset,
            @DefaultValue("100") @Positive int foodAttempts) {

        public static Snake defaults() {
            return new Snake(20, 20, 10, 8, 3, 2, 100);
        }
    }
}
