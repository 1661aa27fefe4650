package com.example.roomhub.handler;

import com.example.roomhub.service.RoomService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RoomWebSocketHandlerTest {

    private RoomService roomService;
    private RoomWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        roomService = mock(RoomService.class);
        handler = new RoomWebSocketHandler(roomService, 5000, 512 * 1024);
    }

    private static WebSocketSession session(String id, String query) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(id);
        when(s.isOpen()).thenReturn(true);
        when(s.getUri()).thenReturn(URI.create("ws://localhost:8080/ws" + (query == null ? "" : "?" + query)));
        return s;
    }

    private WebSocketSession open(WebSocketSession raw) throws Exception {
        handler.afterConnectionEstablished(raw);
        ArgumentCaptor<WebSocketSession> captor = ArgumentCaptor.forClass(WebSocketSession.class);
        verify(roomService).connect(captor.capture(), anyString(), anyString());
        return captor.getValue();
    }

    @Test
    void connectUsesQueryParametersAndDecoratesSession() throws Exception {
        WebSocketSession raw = session("s1", "roomCode=team%20x&participantName=%20Alice%20");

        WebSocketSession decorated = open(raw);

        assertInstanceOf(ConcurrentWebSocketSessionDecorator.class, decorated);
        assertEquals("s1", decorated.getId());
        verify(roomService).connect(decorated, "team x", "Alice");
    }

    @Test
    void missingParametersFallBackToDefaults() throws Exception {
        handler.afterConnectionEstablished(session("s1", null));
        verify(roomService).connect(any(), eq("lobby"), eq("Guest"));
    }

    @Test
    void overlongNamesAreCapped() {
        String name = RoomWebSocketHandler.normalizeName("x".repeat(200));
        assertEquals(RoomWebSocketHandler.MAX_NAME_LENGTH, name.length());
        assertEquals("Guest", RoomWebSocketHandler.normalizeName("   "));
    }

    @Test
    void routesMessagesByType() throws Exception {
        WebSocketSession raw = session("s1", "roomCode=r&participantName=alice");
        WebSocketSession decorated = open(raw);

        handler.handleTextMessage(raw, new TextMessage(
                "{\"type\":\"change_activity\",\"activity_type\":\"snake\",\"config\":{\"grid_width\":30}}"));
        verify(roomService).requestActivityChange(decorated, "snake", Map.of("grid_width", 30));

        handler.handleTextMessage(raw, new TextMessage("{\"type\":\"activity:youtube:seek\",\"time\":12.5}"));
        verify(roomService).handleActivityAction(eq(decorated), eq("activity:youtube:seek"),
                argThat(m -> Double.valueOf(12.5).equals(m.get("time"))));

        handler.handleTextMessage(raw, new TextMessage("{\"type\":\"get_room_info\"}"));
        verify(roomService).sendRoomInfo(decorated);

        handler.handleTextMessage(raw, new TextMessage("{\"type\":\"message\",\"message\":\"hi\"}"));
        verify(roomService).chat(decorated, "hi");
    }

    @Test
    void untypedFrameWithMessageIsChat() throws Exception {
        WebSocketSession raw = session("s1", "roomCode=r&participantName=alice");
        WebSocketSession decorated = open(raw);

        handler.handleTextMessage(raw, new TextMessage("{\"message\":\"yo\"}"));

        verify(roomService).chat(decorated, "yo");
    }

    @Test
    void changeActivityWithoutConfigPassesEmptyMap() throws Exception {
        WebSocketSession raw = session("s1", "roomCode=r&participantName=alice");
        WebSocketSession decorated = open(raw);

        handler.handleTextMessage(raw, new TextMessage("{\"type\":\"change_activity\",\"activity_type\":\"chat\"}"));

        verify(roomService).requestActivityChange(decorated, "chat", Map.of());
    }

    @Test
    void unknownTypeAndMalformedFramesAreReported() throws Exception {
        WebSocketSession raw = session("s1", "roomCode=r&participantName=alice");
        WebSocketSession decorated = open(raw);

        handler.handleTextMessage(raw, new TextMessage("{\"type\":\"dance\"}"));
        verify(roomService).sendError(decorated, "Unknown message type: dance");

        handler.handleTextMessage(raw, new TextMessage("not json"));
        handler.handleTextMessage(raw, new TextMessage("[1,2,3]"));
        verify(roomService, times(2)).sendError(decorated, "Invalid message format");
    }

    @Test
    void closeDisconnectsDecoratedSessionOnce() throws Exception {
        WebSocketSession raw = session("s1", "roomCode=r&participantName=alice");
        WebSocketSession decorated = open(raw);

        handler.afterConnectionClosed(raw, CloseStatus.NORMAL);
        handler.afterConnectionClosed(raw, CloseStatus.NORMAL);

        verify(roomService, times(1)).disconnect(decorated);
    }

    @Test
    void framesFromUnknownSessionsAreIgnored() throws Exception {
        WebSocketSession stranger = session("zz", null);

        handler.handleTextMessage(stranger, new TextMessage("{\"type\":\"get_room_info\"}"));

        verifyNoInteractions(roomService);
    }
}
