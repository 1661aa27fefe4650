package com.example.roomhub.support;

import com.example.roomhub.activity.RoomChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Captures everything an activity delivers, in order. */
public class RecordingChannel implements RoomChannel {

    public record Delivery(Map<String, Object> message, String excluded, String target) {
        public Object type() {
            return message.get("type");
        }
    }

    private final String roomId;
    private final Object mutex = new Object();
    private final List<Delivery> deliveries = new ArrayList<>();

    public RecordingChannel(String roomId) {
        this.roomId = roomId;
    }

    @Override
    public String roomId() {
        return roomId;
    }

    @Override
    public Object mutex() {
        return mutex;
    }

    @Override
    public synchronized void broadcast(Map<String, Object> message, String excludeIdentity) {
        deliveries.add(new Delivery(message, excludeIdentity, null));
    }

    @Override
    public synchronized void sendTo(String identity, Map<String, Object> message) {
        deliveries.add(new Delivery(message, null, identity));
    }

    public synchronized List<Delivery> deliveries() {
        return new ArrayList<>(deliveries);
    }

    public synchronized List<Delivery> ofType(String type) {
        return deliveries.stream().filter(d -> type.equals(d.type())).collect(Collectors.toList());
    }

    public synchronized Delivery last(String type) {
        List<Delivery> list = ofType(type);
        return list.isEmpty() ? null : list.get(list.size() - 1);
    }

    public synchronized void clear() {
        deliveries.clear();
    }
}
