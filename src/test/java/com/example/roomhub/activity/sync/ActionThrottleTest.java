package com.example.roomhub.activity.sync;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionThrottleTest {

    private final ActionThrottle throttle = new ActionThrottle(Map.of("seek", 1.0, "play", 0.5));

    @Test
    void admitsFirstAttemptAndReportsRemainingWait() {
        assertEquals(0.0, throttle.tryAcquire("a", "seek", 10.0));
        assertEquals(0.6, throttle.tryAcquire("a", "seek", 10.4), 1e-9);
        assertEquals(0.0, throttle.tryAcquire("a", "seek", 11.0));
    }

    @Test
    void throttledAttemptDoesNotRestartWindow() {
        throttle.tryAcquire("a", "play", 10.0);
        throttle.tryAcquire("a", "play", 10.3);
        assertEquals(0.0, throttle.tryAcquire("a", "play", 10.5));
    }

    @Test
    void actionsWithoutCooldownAreNeverTracked() {
        assertEquals(0.0, throttle.tryAcquire("a", "buffer_start", 1.0));
        assertEquals(0.0, throttle.tryAcquire("a", "buffer_start", 1.0));
        assertEquals(0, throttle.trackedIdentities());
    }

    @Test
    void forgetDropsIdentity() {
        throttle.tryAcquire("a", "seek", 1.0);
        throttle.tryAcquire("b", "seek", 1.0);
        throttle.forget("a");

        assertEquals(1, throttle.trackedIdentities());
        assertEquals(0.0, throttle.tryAcquire("a", "seek", 1.1));
    }
}
