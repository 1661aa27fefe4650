package com.example.roomhub.config;

import com.example.roomhub.handler.RoomWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the room endpoint. Origins come from a CSV property and are used as patterns as-is;
 * an empty list or {@code debug-open} accepts any origin.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RoomWebSocketHandler handler;
    private final String wsPath;
    private final String[] originPatterns;

    public WebSocketConfig(
            RoomWebSocketHandler handler,
            @Value("${app.websocket.path:/ws}") String wsPath,
            @Value("${app.websocket.allowed-origins:http://localhost:5173}") String originsCsv,
            @Value("${app.websocket.debug-open:false}") boolean allowAll
    ) {
        this.handler = handler;
        this.wsPath = wsPath;
        this.originPatterns = allowAll ? new String[] {"*"} : originPatterns(originsCsv);
    }

    static String[] originPatterns(String originsCsv) {
        String[] origins = StringUtils.tokenizeToStringArray(originsCsv, ",");
        return origins.length == 0 ? new String[] {"*"} : origins;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, wsPath)
                .setAllowedOriginPatterns(originPatterns);
    }
}
