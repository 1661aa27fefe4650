package com.example.roomhub.handler;

import com.example.roomhub.service.RoomService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for the room endpoint.
 * - Joins by roomCode + participantName query parameters
 * - Every frame is a JSON object routed by its {@code type}:
 *   change_activity, activity:&lt;type&gt;:&lt;action&gt;, get_room_info, message
 * - Sessions are wrapped in a {@link ConcurrentWebSocketSessionDecorator}, so broadcasts from
 *   several threads never interleave and a slow client only fills its own buffer
 */
@Component
public class RoomWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RoomWebSocketHandler.class);

    static final int MAX_NAME_LENGTH = 80;

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final RoomService roomService;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /** Raw session id → decorated session handed to the service. */
    private final Map<String, WebSocketSession> bySession = new ConcurrentHashMap<>();

    @Autowired
    public RoomWebSocketHandler(
            RoomService roomService,
            @Value("${app.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.websocket.send-buffer-size-limit:524288}") int sendBufferSizeLimit) {
        this.roomService = roomService;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        try {
            Map<String, String> q = parseQuery(session.getUri());
            final String roomCode = orDefault(q.get("roomCode"), "lobby");
            final String name     = normalizeName(q.get("participantName"));

            log.info("WS OPEN room={} name={} sid={}", roomCode, name, session.getId());

            WebSocketSession decorated =
                    new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
            bySession.put(session.getId(), decorated);
            roomService.connect(decorated, roomCode, name);
        } catch (RuntimeException e) {
            log.error("WS afterConnectionEstablished failed (sid={}, uri={})", session.getId(), safeUri(session), e);
            bySession.remove(session.getId());
            session.close(CloseStatus.SERVER_ERROR);
            throw e;
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        WebSocketSession target = bySession.get(session.getId());
        if (target == null) {
            log.warn("WS message from unknown session sid={} payload={}", session.getId(), message.getPayload());
            return;
        }

        Map<String, Object> data;
        try {
            data = objectMapper.readValue(message.getPayload(), JSON_OBJECT);
        } catch (JsonProcessingException e) {
            data = null;
        }
        if (data == null) {
            log.debug("WS invalid frame sid={} payload={}", session.getId(), message.getPayload());
            roomService.sendError(target, "Invalid message format");
            return;
        }

        Object rawType = data.get("type");
        String type = (rawType == null) ? "message" : String.valueOf(rawType);

        try {
            if (type.startsWith("activity:")) {
                roomService.handleActivityAction(target, type, data);
                return;
            }
            switch (type) {
                case "change_activity" -> roomService.requestActivityChange(
                        target, textOf(data.get("activity_type")), configOf(data.get("config")));
                case "get_room_info" -> roomService.sendRoomInfo(target);
                default -> {
                    if ("message".equals(type) || data.containsKey("message")) {
                        roomService.chat(target, textOf(data.get("message")));
                    } else {
                        roomService.sendError(target, "Unknown message type: " + type);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("WS handleTextMessage failed (sid={}, type={})", session.getId(), type, e);
            roomService.sendError(target, "Internal error");
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        WebSocketSession target = bySession.remove(session.getId());
        log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
        if (target == null) return;
        try {
            roomService.disconnect(target);
        } catch (RuntimeException e) {
            log.error("WS afterConnectionClosed handling failed (sid={})", session.getId(), e);
        }
    }

    /* ---------------- helpers ---------------- */

    static String normalizeName(String raw) {
        String name = orDefault(raw, "Guest");
        return (name.length() > MAX_NAME_LENGTH) ? name.substring(0, MAX_NAME_LENGTH) : name;
    }

    private static String orDefault(String raw, String fallback) {
        if (raw == null) return fallback;
        String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static String textOf(Object value) {
        return (value == null) ? null : String.valueOf(value);
    }

    private Map<String, Object> configOf(Object value) {
        return (value instanceof Map<?, ?>) ? objectMapper.convertValue(value, JSON_OBJECT) : Map.of();
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new ConcurrentHashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }
}
