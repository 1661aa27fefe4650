package com.example.roomhub.service;

import com.example.roomhub.activity.Activity;
import com.example.roomhub.activity.ActivityRegistry;
import com.example.roomhub.activity.ActivityType;
import com.example.roomhub.activity.Messages;
import com.example.roomhub.activity.RoomChannel;
import com.example.roomhub.model.Member;
import com.example.roomhub.model.Room;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Room service: room registry, membership, host succession, activity switching and delivery.
 * Every room mutation happens under {@code synchronized (room)}; the same monitor guards the
 * room's activity, including its background loop. Outbound frames are queued per connection under
 * the monitor and written by the delivery executor, so no socket write ever holds a room lock.
 */
@Service
public class RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);

    /** Result types after which every member receives a fresh activity snapshot. */
    static final Set<String> STATE_CHANGING_RESULTS = Set.of(
            "youtube_video_loaded",
            "youtube_play",
            "youtube_pause",
            "youtube_seek",
            "youtube_rate_changed",
            "snake_joined",
            "snake_game_started",
            "snake_game_restarted");

    /** Outcome of {@link #changeActivity}; failures go back as {@code activity_change_error}. */
    public record ActivityChange(boolean success, String message) {
        static ActivityChange ok(String message) { return new ActivityChange(true, message); }
        static ActivityChange fail(String message) { return new ActivityChange(false, message); }
    }

    private final ActivityRegistry registry;
    private final Executor housekeeping;
    private final Executor delivery;
    private final ExecutorService ownedHousekeeping;
    private final ExecutorService ownedDelivery;

    private final ObjectMapper objectMapper = new ObjectMapper();

    // --- in-memory state ---
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, Room> sessionToRoom = new ConcurrentHashMap<>();
    private final Map<String, Outbox> outboxes = new ConcurrentHashMap<>();

    @Autowired
    public RoomService(ActivityRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ownedHousekeeping = Executors.newSingleThreadExecutor(daemon("room-housekeeping"));
        this.ownedDelivery = Executors.newCachedThreadPool(daemon("room-delivery"));
        this.housekeeping = ownedHousekeeping;
        this.delivery = ownedDelivery;
    }

    /** For tests: delivery and cleanup of evicted connections run on the given executor (e.g. {@code Runnable::run}). */
    public RoomService(ActivityRegistry registry, Executor housekeeping) {
        this(registry, housekeeping, housekeeping);
    }

    public RoomService(ActivityRegistry registry, Executor housekeeping, Executor delivery) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.housekeeping = Objects.requireNonNull(housekeeping, "housekeeping");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.ownedHousekeeping = null;
        this.ownedDelivery = null;
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // --- rooms ---
    public Room getRoom(String roomId) { return rooms.get(roomId); }
    public Room getRoomForSession(WebSocketSession session) { return sessionToRoom.get(session.getId()); }
    public int roomCount() { return rooms.size(); }
    public List<Map<String, Object>> availableActivities() { return registry.availableActivities(); }

    // ========================================================================
    //  CONNECT / DISCONNECT
    // ========================================================================

    /**
     * Binds the session to {@code roomId} under {@code name}. The first connection of a new room
     * becomes host and the room starts with the default activity.
     */
    public Room connect(WebSocketSession session, String roomId, String name) {
        String key = (roomId == null || roomId.isBlank()) ? "lobby" : roomId.trim();
        Member member = new Member(session, name);

        while (true) {
            Room room = rooms.computeIfAbsent(key, Room::new);
            synchronized (room) {
                if (room.isClosed()) {
                    // lost the race against teardown of the previous room under this key
                    rooms.remove(key, room);
                    continue;
                }

                if (room.getActivity() == null) {
                    room.setHost(name);
                    Activity activity = registry.create(registry.defaultType(), new Channel(room), Map.of());
                    activity.start();
                    room.setActivity(activity);
                    log.info("Room created room={} host={} activity={}", key, name, activity.type().wireName());
                }

                room.addMember(member);
                sessionToRoom.put(session.getId(), room);
                outboxes.put(session.getId(), new Outbox());
                room.getActivity().addMember(name);

                sendRole(room, member);
                send(room, member, room.getActivity().snapshotFor(name));

                Map<String, Object> available = Messages.message("available_activities");
                available.put("activities", registry.availableActivities());
                send(room, member, available);

                Map<String, Object> joined = Messages.message("user_joined");
                joined.put("username", name);
                joined.put("message", name + " joined the room");
                deliver(room, joined, m -> m.sessionId().equals(member.sessionId()));
            }
            log.info("Member joined room={} name={} sid={}", key, name, session.getId());
            return room;
        }
    }

    /** Regular close of a session. Safe to call for sessions that were already evicted. */
    public void disconnect(WebSocketSession session) {
        Room room = sessionToRoom.remove(session.getId());
        if (room == null) return;
        Outbox box = outboxes.remove(session.getId());
        if (box != null) box.close();

        Member member;
        synchronized (room) {
            member = room.removeMember(session.getId());
        }
        if (member == null) return;
        leave(room, member);
    }

    /**
     * Runs the departure of a member that is no longer in the room's member map:
     * activity hook, {@code user_left}, host succession, or teardown if the room is now empty.
     */
    private void leave(Room room, Member member) {
        String name = member.name();
        Activity toStop = null;

        synchronized (room) {
            if (room.isClosed()) return;

            Activity activity = room.getActivity();
            if (activity != null && !room.hasMemberNamed(name)) {
                activity.removeMember(name);
            }

            if (room.isEmpty()) {
                room.close();
                room.setActivity(null);
                room.setHost(null);
                rooms.remove(room.getId(), room);
                toStop = activity;
            } else {
                Map<String, Object> left = Messages.message("user_left");
                left.put("username", name);
                left.put("message", name + " left the room");
                deliver(room, left, m -> false);

                String previousHost = room.getHost();
                String newHost = room.assignNewHostIfNecessary();
                if (newHost != null) {
                    log.info("Host changed room={} from={} to={}", room.getId(), previousHost, newHost);
                    Map<String, Object> changed = Messages.message("host_changed");
                    changed.put("host", newHost);
                    changed.put("previous_host", previousHost);
                    deliver(room, changed, m -> false);
                    for (Member m : room.getMembers()) {
                        if (m.name().equals(newHost)) sendRole(room, m);
                    }
                }
            }
        }

        log.info("Member left room={} name={} sid={}", room.getId(), name, member.sessionId());

        if (toStop != null) {
            toStop.stop();
            log.info("Room destroyed room={}", room.getId());
        }
    }

    // ========================================================================
    //  ACTIVITY SWITCHING
    // ========================================================================

    /**
     * Host-only switch to another activity. The previous activity is stopped (and its loop awaited)
     * outside the room monitor; the new one absorbs the current membership.
     */
    public ActivityChange changeActivity(String roomId, String requester, ActivityType type, Map<String, Object> config) {
        Room room = rooms.get(roomId);
        if (room == null) return ActivityChange.fail("Room not found");

        Activity previous;
        Activity next;
        synchronized (room) {
            if (room.isClosed()) return ActivityChange.fail("Room was closed");
            if (!room.isHost(requester)) return ActivityChange.fail("Only the room host can change activities");
            previous = room.getActivity();
            next = registry.create(type, new Channel(room), config);
        }

        if (previous != null) previous.stop();

        synchronized (room) {
            if (room.isClosed()) return ActivityChange.fail("Room was closed");
            if (room.getActivity() != previous) return ActivityChange.fail("Activity change already in progress");

            next.start();
            room.setActivity(next);
            for (String name : room.getMemberNames()) next.addMember(name);

            Map<String, Object> changed = Messages.message("activity_changed");
            changed.put("activity_type", type.wireName());
            changed.put("activity_name", type.displayName());
            changed.put("changed_by", requester);
            deliver(room, changed, m -> false);

            pushSnapshots(room);
        }

        log.info("Activity changed room={} type={} by={}", roomId, type.wireName(), requester);
        return ActivityChange.ok("Activity changed to " + type.displayName());
    }

    /** {@code change_activity} from a connection; errors go back to that connection only. */
    public void requestActivityChange(WebSocketSession session, String rawType, Map<String, Object> config) {
        Room room = sessionToRoom.get(session.getId());
        if (room == null) return;

        Optional<ActivityType> type = ActivityType.fromWire(rawType);
        if (type.isEmpty()) {
            sendError(session, "Invalid activity type: " + rawType);
            return;
        }

        String name = nameOf(room, session);
        if (name == null) return;

        ActivityChange change = changeActivity(room.getId(), name, type.get(), config);
        if (!change.success()) {
            log.debug("Activity change rejected room={} by={} reason={}", room.getId(), name, change.message());
            Map<String, Object> err = Messages.message("activity_change_error");
            err.put("message", change.message());
            send(session, err);
        }
    }

    // ========================================================================
    //  ACTIVITY ACTIONS / CHAT
    // ========================================================================

    /** Routes {@code activity:<type>:<action>} to the room's current activity. */
    public void handleActivityAction(WebSocketSession session, String messageType, Map<String, Object> payload) {
        Room room = sessionToRoom.get(session.getId());
        if (room == null) return;

        String[] parts = messageType.split(":", 3);
        if (parts.length < 3 || parts[2].isBlank()) {
            sendError(session, "Invalid activity message: " + messageType);
            return;
        }

        synchronized (room) {
            Member member = room.getMember(session.getId());
            Activity activity = room.getActivity();
            if (member == null || activity == null) return;

            if (!activity.type().wireName().equals(parts[1])) {
                send(room, member, Messages.error("Activity " + parts[1] + " is not active (current: "
                        + activity.type().wireName() + ")"));
                return;
            }

            Map<String, Object> result;
            try {
                result = activity.handleAction(member.name(), parts[2], payload);
            } catch (RuntimeException e) {
                log.error("Activity action failed (room={}, name={}, action={})",
                        room.getId(), member.name(), messageType, e);
                result = Messages.error("Activity action failed: " + e.getMessage());
            }
            if (result == null) return;

            Object resultType = result.get("type");
            if ("message".equals(resultType)) {
                relayChat(room, member, result);
                return;
            }

            send(room, member, result);
            if (STATE_CHANGING_RESULTS.contains(resultType)) pushSnapshots(room);
        }
    }

    /** Room chat outside any activity; empty messages are dropped. */
    public void chat(WebSocketSession session, String text) {
        if (text == null || text.isEmpty()) return;
        Room room = sessionToRoom.get(session.getId());
        if (room == null) return;

        synchronized (room) {
            Member member = room.getMember(session.getId());
            if (member == null) return;

            Map<String, Object> msg = Messages.message("message");
            msg.put("username", member.name());
            msg.put("message", text);
            relayChat(room, member, msg);
        }
    }

    private void relayChat(Room room, Member sender, Map<String, Object> msg) {
        deliver(room, msg, m -> m.sessionId().equals(sender.sessionId()));

        Map<String, Object> echo = new LinkedHashMap<>(msg);
        echo.put("own_message", true);
        send(room, sender, echo);
    }

    // ========================================================================
    //  ROOM INFO
    // ========================================================================

    /** {@code room_info} body; null when the room does not exist. */
    public Map<String, Object> roomInfo(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) return null;
        synchronized (room) {
            if (room.isClosed()) return null;
            Activity activity = room.getActivity();

            Map<String, Object> info = Messages.message("room_info");
            info.put("room_id", room.getId());
            info.put("host", room.getHost());
            info.put("current_activity", (activity != null) ? activity.type().wireName() : null);
            info.put("available_activities", registry.availableActivities());
            info.put("user_count", room.size());
            return info;
        }
    }

    public void sendRoomInfo(WebSocketSession session) {
        Room room = sessionToRoom.get(session.getId());
        if (room == null) return;
        Map<String, Object> info = roomInfo(room.getId());
        if (info != null) send(session, info);
    }

    // ========================================================================
    //  DELIVERY
    // ========================================================================

    /** Deliver to every member of {@code roomId} except connections named {@code excludeIdentity}. */
    public void broadcast(String roomId, Map<String, Object> message, String excludeIdentity) {
        Room room = rooms.get(roomId);
        if (room == null) return;
        deliver(room, message, m -> excludeIdentity != null && excludeIdentity.equals(m.name()));
    }

    /** Deliver to the connection bound to {@code identity}; no-op if it is not in the room. */
    public void sendToMember(String roomId, String identity, Map<String, Object> message) {
        Room room = rooms.get(roomId);
        if (room == null) return;
        sendToMember(room, identity, message);
    }

    private void sendToMember(Room room, String identity, Map<String, Object> message) {
        synchronized (room) {
            room.findByName(identity).ifPresent(m -> send(room, m, message));
        }
    }

    /** Direct reply to a session (room member or not). */
    public void send(WebSocketSession session, Map<String, Object> message) {
        Room room = sessionToRoom.get(session.getId());
        if (room != null) {
            synchronized (room) {
                Member member = room.getMember(session.getId());
                if (member != null) {
                    send(room, member, message);
                    return;
                }
            }
        }
        String json = toJson(message);
        if (json == null) return;
        try {
            if (session.isOpen()) session.sendMessage(new TextMessage(json));
        } catch (IOException | IllegalStateException e) {
            log.warn("WS send failed (sid={}): {}", session.getId(), e.toString());
        }
    }

    public void sendError(WebSocketSession session, String text) {
        send(session, Messages.error(text));
    }

    private void pushSnapshots(Room room) {
        Activity activity = room.getActivity();
        if (activity == null) return;
        for (Member m : room.getMembers()) {
            send(room, m, activity.snapshotFor(m.name()));
        }
    }

    private void sendRole(Room room, Member member) {
        boolean host = room.isHost(member.name());
        Map<String, Object> role = Messages.message("role_assigned");
        role.put("role", host ? "host" : "participant");
        role.put("is_host", host);
        role.put("host", room.getHost());
        send(room, member, role);
    }

    /** Queues the frame for every member not skipped; one serialization for all recipients. */
    private void deliver(Room room, Map<String, Object> message, Predicate<Member> skip) {
        String json = toJson(message);
        if (json == null) return;
        synchronized (room) {
            for (Member m : room.getMembers()) {
                if (!skip.test(m)) enqueue(room, m, json);
            }
        }
    }

    private void send(Room room, Member member, Map<String, Object> message) {
        String json = toJson(message);
        if (json == null) return;
        synchronized (room) {
            enqueue(room, member, json);
        }
    }

    /**
     * Appends to the member's outbox; callers hold the room monitor, so every member sees the room's
     * events in one order. The write itself happens on the delivery executor.
     */
    private void enqueue(Room room, Member member, String json) {
        Outbox box = outboxes.get(member.sessionId());
        if (box == null || !box.offer(json)) return;

        if (box.trySchedule()) {
            try {
                delivery.execute(() -> drain(room, member, box));
            } catch (RejectedExecutionException e) {
                box.unschedule();
                log.debug("Delivery rejected (shutting down) room={} sid={}", room.getId(), member.sessionId());
            }
        } else if (isStalled(member.session(), box)) {
            evict(room, member, "send limits exceeded");
        }
    }

    /** Writes queued frames in order until the outbox is empty or the connection was evicted. */
    private void drain(Room room, Member member, Outbox box) {
        do {
            String json;
            while ((json = box.poll()) != null) {
                if (!write(room, member, json)) return;
            }
            box.unschedule();
        } while (!box.isEmpty() && box.trySchedule());
    }

    private boolean write(Room room, Member member, String json) {
        WebSocketSession session = member.session();
        try {
            if (!session.isOpen()) {
                evict(room, member, "closed");
                return false;
            }
            session.sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | SessionLimitExceededException | IllegalStateException e) {
            evict(room, member, e.toString());
            return false;
        }
    }

    /**
     * A write in flight longer than the session's send-time limit, or a backlog beyond its buffer
     * limit, marks the connection as too slow to keep.
     */
    private static boolean isStalled(WebSocketSession session, Outbox box) {
        if (!(session instanceof ConcurrentWebSocketSessionDecorator)) return false;
        ConcurrentWebSocketSessionDecorator decorator = (ConcurrentWebSocketSessionDecorator) session;
        return decorator.getTimeSinceSendStarted() > decorator.getSendTimeLimit()
                || box.pendingChars() > decorator.getBufferSizeLimit();
    }

    /**
     * Removes a broken connection from the room at once. The close and the rest of the departure run
     * on executors so neither a sender nor a room-lock holder blocks on them.
     */
    private void evict(Room room, Member member, String reason) {
        boolean removed;
        synchronized (room) {
            removed = room.removeMember(member.sessionId()) != null;
        }
        Outbox box = outboxes.remove(member.sessionId());
        if (box != null) box.close();
        if (!removed) return;
        sessionToRoom.remove(member.sessionId(), room);
        log.warn("WS EVICT room={} name={} sid={} reason={}", room.getId(), member.name(), member.sessionId(), reason);

        try {
            delivery.execute(() -> closeUnreliable(member));
            housekeeping.execute(() -> leave(room, member));
        } catch (RejectedExecutionException e) {
            log.warn("Housekeeping rejected departure of {} from room {}", member.name(), room.getId());
        }
    }

    private static void closeUnreliable(Member member) {
        try {
            if (member.session().isOpen()) member.session().close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close after eviction failed sid={}: {}", member.sessionId(), e.toString());
        }
    }

    private String toJson(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize message type={}", message.get("type"), e);
            return null;
        }
    }

    private static String nameOf(Room room, WebSocketSession session) {
        synchronized (room) {
            Member m = room.getMember(session.getId());
            return (m != null) ? m.name() : null;
        }
    }

    // ========================================================================
    //  SHUTDOWN
    // ========================================================================

    @PreDestroy
    public void shutdown() {
        List<Activity> running = new ArrayList<>();
        for (Room room : rooms.values()) {
            synchronized (room) {
                room.close();
                if (room.getActivity() != null) running.add(room.getActivity());
                room.setActivity(null);
            }
        }
        rooms.clear();
        sessionToRoom.clear();
        outboxes.values().forEach(Outbox::close);
        outboxes.clear();
        running.forEach(Activity::stop);
        if (ownedHousekeeping != null) ownedHousekeeping.shutdownNow();
        if (ownedDelivery != null) ownedDelivery.shutdownNow();
        log.info("Room service stopped ({} activities)", running.size());
    }

    // ---------------------------------------------------------------------
    // Delivery capability handed to activities
    // ---------------------------------------------------------------------

    private final class Channel implements RoomChannel {

        private final Room room;

        Channel(Room room) {
            this.room = room;
        }

        @Override
        public String roomId() {
            return room.getId();
        }

        @Override
        public Object mutex() {
            return room;
        }

        @Override
        public void broadcast(Map<String, Object> message, String excludeIdentity) {
            deliver(room, message, m -> excludeIdentity != null && excludeIdentity.equals(m.name()));
        }

        @Override
        public void sendTo(String identity, Map<String, Object> message) {
            sendToMember(room, identity, message);
        }
    }
}
