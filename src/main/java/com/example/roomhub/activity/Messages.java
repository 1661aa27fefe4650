package com.example.roomhub.activity;

import java.util.LinkedHashMap;
import java.util.Map;

/** Builders for outbound JSON-shaped payloads. */
public final class Messages {

    private Messages() { }

    public static Map<String, Object> message(String type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        return m;
    }

    public static Map<String, Object> error(String text) {
        Map<String, Object> m = message("error");
        m.put("message", text);
        return m;
    }

    public static String text(Map<String, Object> payload, String key) {
        if (payload == null) return null;
        Object v = payload.get(key);
        return (v == null) ? null : String.valueOf(v);
    }

    /** Finite numeric value of {@code key}; null when absent, unparsable, NaN or infinite. */
    public static Double number(Map<String, Object> payload, String key) {
        if (payload == null) return null;
        Object v = payload.get(key);
        double d;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else if (v instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    public static Boolean flag(Map<String, Object> payload, String key) {
        if (payload == null) return null;
        Object v = payload.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) return Boolean.parseBoolean(s.trim());
        return null;
    }
}
