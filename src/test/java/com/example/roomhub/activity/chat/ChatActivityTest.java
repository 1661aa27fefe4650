package com.example.roomhub.activity.chat;

import com.example.roomhub.support.MutableClock;
import com.example.roomhub.support.RecordingChannel;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChatActivityTest {

    private final ChatActivity chat = new ChatActivity(new RecordingChannel("c"), new MutableClock(5_000L), 100L);

    @Test
    void messageIsCountedAndReturnedForRelay() {
        chat.addMember("alice");

        Map<String, Object> r = chat.handleAction("alice", "message", Map.of("message", "hi"));

        assertEquals("message", r.get("type"));
        assertEquals("alice", r.get("username"));
        assertEquals("hi", r.get("message"));
        assertEquals(1, chat.getMessageCount());

        @SuppressWarnings("unchecked")
        Map<String, Object> state = (Map<String, Object>) chat.snapshotFor("alice").get("state");
        assertEquals(1, state.get("message_count"));
        @SuppressWarnings("unchecked")
        Map<String, Object> last = (Map<String, Object>) state.get("last_message");
        assertEquals("alice", last.get("user"));
        assertEquals("hi", last.get("text"));
    }

    @Test
    void otherActionsAreRejected() {
        assertEquals("Unknown action for chat", chat.handleAction("alice", "typing", Map.of()).get("message"));
    }
}
