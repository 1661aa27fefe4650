package com.example.roomhub.model;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoomTest {

    private static Member member(String sid, String name) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(sid);
        return new Member(s, name);
    }

    @Test
    void blankIdFallsBackToLobby() {
        assertEquals("lobby", new Room("  ").getId());
        assertEquals("team", new Room(" team ").getId());
    }

    @Test
    void membersKeepJoinOrderAndNamesAreDistinct() {
        Room r = new Room("X");
        r.addMember(member("1", "alice"));
        r.addMember(member("2", "bob"));
        r.addMember(member("3", "alice")); // second tab, same name

        assertEquals(3, r.size());
        assertEquals(List.of("alice", "bob"), r.getMemberNames());
        assertEquals("1", r.findByName("alice").orElseThrow().sessionId());
    }

    @Test
    void hostSuccessionPicksLongestConnectedMember() {
        Room r = new Room("X");
        r.addMember(member("1", "alice"));
        r.addMember(member("2", "bob"));
        r.addMember(member("3", "carol"));
        r.setHost("alice");

        assertNull(r.assignNewHostIfNecessary(), "host still present");

        r.removeMember("1");
        assertEquals("bob", r.assignNewHostIfNecessary());
        assertTrue(r.isHost("bob"));

        r.removeMember("2");
        r.removeMember("3");
        assertNull(r.assignNewHostIfNecessary());
        assertNull(r.getHost());
        assertTrue(r.isEmpty());
    }

    @Test
    void hostWithSecondConnectionStaysHost() {
        Room r = new Room("X");
        r.addMember(member("1", "alice"));
        r.addMember(member("2", "bob"));
        r.addMember(member("3", "alice"));
        r.setHost("alice");

        r.removeMember("1");

        assertNull(r.assignNewHostIfNecessary());
        assertEquals("alice", r.getHost());
    }

    @Test
    void removingUnknownSessionIsNoop() {
        Room r = new Room("X");
        assertNull(r.removeMember("missing"));
        assertNull(r.removeMember(null));
    }
}
