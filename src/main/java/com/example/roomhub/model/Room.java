package com.example.roomhub.model;

import com.example.roomhub.activity.Activity;

import java.util.*;

/**
 * Room model: member connections, host name and the running activity.
 * RoomService synchronizes on Room instances, so this class itself does not add extra locking.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String id;

    /** Members by session id (insertion order preserved; drives host succession). */
    private final Map<String, Member> members = new LinkedHashMap<>();

    /** Current host display name; null only while the room is torn down. */
    private String host;

    private Activity activity;

    /** Set once the last member left; a closed room is never reused. */
    private boolean closed = false;

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String id) {
        this.id = (id == null || id.isBlank()) ? "lobby" : id.trim();
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public boolean isHost(String name) {
        return name != null && name.equals(host);
    }

    public Activity getActivity() {
        return activity;
    }

    public void setActivity(Activity activity) {
        this.activity = activity;
    }

    public boolean isClosed() {
        return closed;
    }

    public void close() {
        this.closed = true;
    }

    // ---------------------------------------------------------------------
    // Members API (used by RoomService)
    // ---------------------------------------------------------------------

    public void addMember(Member member) {
        if (member == null) return;
        members.put(member.sessionId(), member);
    }

    public Member removeMember(String sessionId) {
        if (sessionId == null) return null;
        return members.remove(sessionId);
    }

    public Member getMember(String sessionId) {
        if (sessionId == null) return null;
        return members.get(sessionId);
    }

    /** Returns a snapshot list of members, preserving join order. */
    public List<Member> getMembers() {
        return new ArrayList<>(members.values());
    }

    /** Distinct member names in join order. */
    public List<String> getMemberNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Member m : members.values()) names.add(m.name());
        return new ArrayList<>(names);
    }

    /** First connection (in join order) bound to the given name. */
    public Optional<Member> findByName(String name) {
        if (name == null) return Optional.empty();
        for (Member m : members.values()) {
            if (name.equals(m.name())) return Optional.of(m);
        }
        return Optional.empty();
    }

    public boolean hasMemberNamed(String name) {
        return findByName(name).isPresent();
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Host succession: the longest-connected remaining member takes over.
     * Returns the new host name, or null if the current host is still present or nobody is left.
     */
    public String assignNewHostIfNecessary() {
        if (host != null && hasMemberNamed(host)) return null;
        Iterator<Member> it = members.values().iterator();
        host = it.hasNext() ? it.next().name() : null;
        return host;
    }
}
