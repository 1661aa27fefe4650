package com.example.roomhub.activity.chat;

import com.example.roomhub.activity.AbstractActivity;
import com.example.roomhub.activity.ActivityType;
import com.example.roomhub.activity.Messages;
import com.example.roomhub.activity.RoomChannel;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** Plain chat: no loop, only a message counter and the last message. */
public class ChatActivity extends AbstractActivity {

    private int messageCount = 0;
    private Map<String, Object> lastMessage;

    public ChatActivity(RoomChannel channel, Clock clock, long stopTimeoutMs) {
        super(ActivityType.CHAT, channel, clock, stopTimeoutMs);
    }

    @Override
    public Map<String, Object> handleAction(String identity, String action, Map<String, Object> payload) {
        if (!"message".equals(action)) {
            return Messages.error("Unknown action for chat");
        }
        String text = Messages.text(payload, "message");
        if (text == null) text = "";

        messageCount++;
        Map<String, Object> last = new LinkedHashMap<>();
        last.put("user", identity);
        last.put("text", text);
        last.put("timestamp", nowSeconds());
        lastMessage = last;

        Map<String, Object> result = Messages.message("message");
        result.put("username", identity);
        result.put("message", text);
        return result;
    }

    @Override
    public Map<String, Object> snapshotFor(String identity) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("message_count", messageCount);
        state.put("last_message", lastMessage);
        return snapshotEnvelope(state);
    }

    int getMessageCount() {
        return messageCount;
    }
}
