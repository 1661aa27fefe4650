package com.example.roomhub.activity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared plumbing: member set, running flag and a private single-thread loop.
 * Every loop iteration runs under the room monitor and is a no-op once the activity stopped.
 */
public abstract class AbstractActivity implements Activity {

    private static final Logger log = LoggerFactory.getLogger(AbstractActivity.class);

    private static final AtomicInteger LOOP_SEQ = new AtomicInteger();

    protected final RoomChannel channel;
    protected final Clock clock;
    protected final Set<String> members = new LinkedHashSet<>();

    private final ActivityType type;
    private final long stopTimeoutMs;

    private volatile boolean running = false;
    private ScheduledExecutorService loop;
    private volatile Thread loopThread;

    protected AbstractActivity(ActivityType type, RoomChannel channel, Clock clock, long stopTimeoutMs) {
        this.type = Objects.requireNonNull(type, "type");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stopTimeoutMs = Math.max(0, stopTimeoutMs);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public ActivityType type() {
        return type;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void start() {
        synchronized (channel.mutex()) {
            if (running) return;
            running = true;
            String name = type.wireName() + "-loop-" + channel.roomId() + "-" + LOOP_SEQ.incrementAndGet();
            loop = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                loopThread = t;
                return t;
            });
            onStart();
        }
        log.info("Activity started type={} room={}", type.wireName(), channel.roomId());
    }

    @Override
    public void stop() {
        ScheduledExecutorService l;
        synchronized (channel.mutex()) {
            if (!running && loop == null) return;
            running = false;
            l = loop;
            loop = null;
        }
        if (l != null) {
            l.shutdownNow();
            awaitLoop(l);
        }
        log.info("Activity stopped type={} room={}", type.wireName(), channel.roomId());
    }

    private void awaitLoop(ScheduledExecutorService l) {
        if (Thread.currentThread() == loopThread) return;
        if (Thread.holdsLock(channel.mutex())) {
            // a queued iteration may be blocked on this monitor; it exits on entry because running is false
            log.debug("Stop without await (room monitor held) type={} room={}", type.wireName(), channel.roomId());
            return;
        }
        try {
            if (!l.awaitTermination(stopTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Activity loop did not terminate within {}ms (type={}, room={})",
                        stopTimeoutMs, type.wireName(), channel.roomId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Called once from {@link #start()} while holding the room monitor. */
    protected void onStart() { }

    // ---------------------------------------------------------------------
    // Scheduling helpers (only valid while running)
    // ---------------------------------------------------------------------

    protected ScheduledFuture<?> scheduleRepeating(Runnable body, long periodMs) {
        ScheduledExecutorService l = loop;
        if (l == null) return null;
        return l.scheduleAtFixedRate(() -> runGuarded(body), periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    protected ScheduledFuture<?> scheduleOnce(Runnable body, long delayMs) {
        ScheduledExecutorService l = loop;
        if (l == null) return null;
        try {
            return l.schedule(() -> runGuarded(body), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Schedule rejected (stopping) type={} room={}", type.wireName(), channel.roomId());
            return null;
        }
    }

    private void runGuarded(Runnable body) {
        try {
            synchronized (channel.mutex()) {
                if (!running) return;
                body.run();
            }
        } catch (RuntimeException e) {
            log.error("Activity loop iteration failed (type={}, room={})", type.wireName(), channel.roomId(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Members
    // ---------------------------------------------------------------------

    @Override
    public void addMember(String identity) {
        if (identity != null) members.add(identity);
    }

    @Override
    public void removeMember(String identity) {
        members.remove(identity);
    }

    // ---------------------------------------------------------------------
    // Helpers for subclasses
    // ---------------------------------------------------------------------

    /** Wall-clock seconds, the unit clients exchange timestamps in. */
    protected double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    protected void broadcast(Map<String, Object> message) {
        channel.broadcast(message, null);
    }

    protected void broadcastExcept(Map<String, Object> message, String excludeIdentity) {
        channel.broadcast(message, excludeIdentity);
    }

    /** Common envelope of {@link #snapshotFor(String)}. */
    protected Map<String, Object> snapshotEnvelope(Map<String, Object> state) {
        Map<String, Object> m = Messages.message("activity_state");
        m.put("activity_type", type.wireName());
        m.put("activity_name", type.displayName());
        m.put("state", state);
        m.put("users", new ArrayList<>(members));
        return m;
    }
}
