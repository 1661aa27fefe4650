package com.example.roomhub.service;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered queue of serialized frames for one connection.
 * Frames are offered under the room monitor and written by at most one delivery task at a time.
 */
final class Outbox {

    private final Queue<String> frames = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicLong pendingChars = new AtomicLong();
    private volatile boolean closed = false;

    /** Returns false once the outbox was closed. */
    boolean offer(String json) {
        if (closed) return false;
        frames.add(json);
        pendingChars.addAndGet(json.length());
        return true;
    }

    String poll() {
        String frame = frames.poll();
        if (frame != null) pendingChars.addAndGet(-frame.length());
        return frame;
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }

    long pendingChars() {
        return pendingChars.get();
    }

    /** Claims the drain; true when the caller must schedule a delivery task. */
    boolean trySchedule() {
        return scheduled.compareAndSet(false, true);
    }

    void unschedule() {
        scheduled.set(false);
    }

    void close() {
        closed = true;
        frames.clear();
        pendingChars.set(0);
    }
}
