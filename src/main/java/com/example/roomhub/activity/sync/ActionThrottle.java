package com.example.roomhub.activity.sync;

import java.util.HashMap;
import java.util.Map;

/**
 * Per (identity, action) cooldown table. An admitted attempt restarts the window even if the
 * action is rejected afterwards; a throttled attempt leaves the table untouched.
 */
final class ActionThrottle {

    private final Map<String, Double> cooldownSeconds;

    /** identity → action → last admitted attempt (epoch seconds). */
    private final Map<String, Map<String, Double>> lastAdmitted = new HashMap<>();

    ActionThrottle(Map<String, Double> cooldownSeconds) {
        this.cooldownSeconds = Map.copyOf(cooldownSeconds);
    }

    /**
     * Admits the attempt and records it, or returns the remaining wait in seconds (&gt; 0).
     * Actions without a configured cooldown are always admitted.
     */
    double tryAcquire(String identity, String action, double now) {
        Double cooldown = cooldownSeconds.get(action);
        if (cooldown == null || cooldown <= 0) return 0;

        Map<String, Double> byAction = lastAdmitted.computeIfAbsent(identity, k -> new HashMap<>());
        Double last = byAction.get(action);
        if (last != null) {
            double elapsed = now - last;
            if (elapsed < cooldown) return cooldown - elapsed;
        }
        byAction.put(action, now);
        return 0;
    }

    double cooldownOf(String action) {
        return cooldownSeconds.getOrDefault(action, 0.0);
    }

    void forget(String identity) {
        lastAdmitted.remove(identity);
    }

    int trackedIdentities() {
        return lastAdmitted.size();
    }
}
