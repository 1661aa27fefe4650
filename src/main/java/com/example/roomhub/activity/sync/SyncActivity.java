package com.example.roomhub.activity.sync;

import com.example.roomhub.activity.AbstractActivity;
import com.example.roomhub.activity.ActivityType;
import com.example.roomhub.activity.Messages;
import com.example.roomhub.activity.RoomChannel;
import com.example.roomhub.config.ActivityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ScheduledFuture;

/**
 * Synchronized video playback.
 * - Master controls load/seek/rate; the first member to join a fresh activity becomes master,
 *   later vacancies are only filled by request_master or load_video
 * - Authoritative member (last accepted play/pause/load/report) may overwrite state via state_report
 * - Offset is extrapolated from {@code anchorTime} while playing and nobody is buffering
 * - Drift loop re-extrapolates and broadcasts when no report arrived for a while
 * - Buffering pauses playback; when the last buffering member finishes, the master's play resumes after a grace delay
 */
public class SyncActivity extends AbstractActivity {

    private static final Logger log = LoggerFactory.getLogger(SyncActivity.class);

    private final ActivityProperties.Sync settings;
    private final ActionThrottle throttle;

    // ---------------------------------------------------------------------
    // Playback state
    // ---------------------------------------------------------------------

    private String videoId;
    private double currentTime = 0.0;
    private boolean playing = false;
    private double playbackRate = 1.0;

    /** Base of offset extrapolation; currentTime is the offset at this instant. */
    private double anchorTime;

    /** Last accepted user action; state reports stamped earlier are stale. */
    private double lastActionTime;

    /** Last time anybody (report, action or drift loop) refreshed the state. */
    private double lastStateUpdate;

    private String lastActionUser;
    private Map<String, Object> lastAction;

    private final Set<String> bufferingUsers = new LinkedHashSet<>();
    private ScheduledFuture<?> pendingResume;

    // ---------------------------------------------------------------------
    // Roles
    // ---------------------------------------------------------------------

    private String masterUser;
    private String authoritativeUser;

    /** Set on the first election; a vacated master role is never refilled by a join. */
    private boolean masterElected = false;

    public SyncActivity(RoomChannel channel, Clock clock, long stopTimeoutMs,
                        ActivityProperties.Sync settings, Map<String, Object> config) {
        super(ActivityType.YOUTUBE, channel, clock, stopTimeoutMs);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.throttle = new ActionThrottle(settings.throttleSeconds());

        String initial = Messages.text(config, "video_id");
        this.videoId = (initial == null || initial.isBlank()) ? null : initial.trim();

        double now = nowSeconds();
        this.anchorTime = now;
        this.lastActionTime = now;
        this.lastStateUpdate = now;
    }

    @Override
    protected void onStart() {
        scheduleRepeating(this::driftCheck, settings.driftIntervalMs());
    }

    // ========================================================================
    //  ACTION DISPATCH
    // ========================================================================

    @Override
    public Map<String, Object> handleAction(String identity, String action, Map<String, Object> payload) {
        String kind = (action == null) ? "" : action;

        double wait = throttle.tryAcquire(identity, kind, nowSeconds());
        if (wait > 0) {
            log.debug("Throttled room={} user={} action={} wait={}s", channel.roomId(), identity, kind, wait);
            return Messages.error(String.format(Locale.ROOT, "Please wait %.1fs before %s again (one per %.1fs)",
                    wait, kind, throttle.cooldownOf(kind)));
        }

        return switch (kind) {
            case "load_video" ->    loadVideo(identity, payload);
            case "play" ->          play(identity);
            case "pause" ->         pause(identity);
            case "seek" ->          seek(identity, payload);
            case "set_rate" ->      setRate(identity, payload);
            case "sync_request" ->  syncResponse();
            case "buffer_start" ->  bufferStart(identity);
            case "buffer_end" ->    bufferEnd(identity);
            case "request_master" -> requestMaster(identity);
            case "state_report" ->  stateReport(identity, payload);
            default ->              Messages.error("Unknown YouTube action: " + kind);
        };
    }

    // ========================================================================
    //  MASTER-ONLY ACTIONS
    // ========================================================================

    private Map<String, Object> loadVideo(String identity, Map<String, Object> payload) {
        if (hasLiveMaster() && !identity.equals(masterUser)) {
            return Messages.error("Only the master user can load videos (master: " + masterUser + ")");
        }
        String id = Messages.text(payload, "video_id");
        if (id == null || id.isBlank()) {
            return Messages.error("Video ID required");
        }
        if (!hasLiveMaster()) {
            assignMaster(identity);
            Map<String, Object> assigned = Messages.message("youtube_master_assigned");
            assigned.put("message", "You are now the master");
            channel.sendTo(identity, assigned);
        }

        double now = nowSeconds();
        Double start = Messages.number(payload, "start_time");

        videoId = id.trim();
        currentTime = (start == null || start < 0) ? 0.0 : start;
        playing = false;
        playbackRate = 1.0;
        anchorTime = now;
        lastActionTime = now;
        lastStateUpdate = now;
        lastActionUser = identity;
        authoritativeUser = identity;
        bufferingUsers.clear();
        cancelPendingResume();
        recordLastAction(identity, "load_video", now);

        Map<String, Object> out = Messages.message("youtube_video_loaded");
        out.put("video_id", videoId);
        out.put("loaded_by", identity);
        out.put("current_time", currentTime);
        broadcast(out);

        log.info("Video loaded room={} video={} by={} at={}", channel.roomId(), videoId, identity, currentTime);

        Map<String, Object> result = Messages.message("youtube_video_loaded");
        result.put("video_id", videoId);
        return result;
    }

    private Map<String, Object> seek(String identity, Map<String, Object> payload) {
        if (videoId == null) return Messages.error("No video loaded");
        if (!identity.equals(masterUser)) return Messages.error("Only the master user can seek");

        Double requested = Messages.number(payload, "time");
        double target = (requested == null || requested < 0) ? 0.0 : requested;
        double now = nowSeconds();

        currentTime = target;
        anchorTime = now;
        lastActionTime = now;
        lastStateUpdate = now;
        lastActionUser = identity;
        recordLastAction(identity, "seek", now);

        Map<String, Object> out = Messages.message("youtube_seek");
        out.put("current_time", target);
        out.put("triggered_by", identity);
        out.put("last_action_user", identity);
        out.put("server_timestamp", now);
        broadcast(out);

        Map<String, Object> result = Messages.message("youtube_seek");
        result.put("current_time", target);
        return result;
    }

    private Map<String, Object> setRate(String identity, Map<String, Object> payload) {
        if (!identity.equals(masterUser)) return Messages.error("Only the master user can change playback rate");

        Double rate = Messages.number(payload, "rate");
        if (rate == null || !(rate > 0 && rate <= settings.maxPlaybackRate())) {
            return Messages.error("Invalid playback rate");
        }
        double now = nowSeconds();
        foldElapsed(now);
        playbackRate = rate;
        lastActionTime = now;
        lastStateUpdate = now;
        recordLastAction(identity, "set_rate", now);

        Map<String, Object> out = Messages.message("youtube_rate_changed");
        out.put("playback_rate", rate);
        out.put("current_time", currentTime);
        out.put("triggered_by", identity);
        broadcast(out);

        Map<String, Object> result = Messages.message("youtube_rate_changed");
        result.put("playback_rate", rate);
        return result;
    }

    // ========================================================================
    //  OPEN ACTIONS
    // ========================================================================

    private Map<String, Object> play(String identity) {
        if (videoId == null) return Messages.error("No video loaded");
        if (!bufferingUsers.isEmpty()) {
            log.debug("Play while buffering room={} by={} buffering={}", channel.roomId(), identity, bufferingUsers);
        }
        double now = nowSeconds();
        foldElapsed(now);
        playing = true;
        lastActionTime = now;
        lastStateUpdate = now;
        lastActionUser = identity;
        authoritativeUser = identity;
        recordLastAction(identity, "play", now);

        Map<String, Object> out = Messages.message("youtube_play");
        out.put("current_time", currentTime);
        out.put("is_playing", true);
        out.put("triggered_by", identity);
        out.put("last_action_user", identity);
        out.put("server_timestamp", now);
        broadcast(out);

        Map<String, Object> result = Messages.message("youtube_play");
        result.put("current_time", currentTime);
        return result;
    }

    private Map<String, Object> pause(String identity) {
        if (videoId == null) return Messages.error("No video loaded");
        double now = nowSeconds();
        foldElapsed(now);
        playing = false;
        lastActionTime = now;
        lastStateUpdate = now;
        lastActionUser = identity;
        authoritativeUser = identity;
        recordLastAction(identity, "pause", now);

        Map<String, Object> out = Messages.message("youtube_pause");
        out.put("current_time", currentTime);
        out.put("is_playing", false);
        out.put("triggered_by", identity);
        out.put("last_action_user", identity);
        out.put("server_timestamp", now);
        broadcast(out);

        Map<String, Object> result = Messages.message("youtube_pause");
        result.put("current_time", currentTime);
        return result;
    }

    private Map<String, Object> syncResponse() {
        Map<String, Object> result = Messages.message("youtube_sync_response");
        result.put("video_id", videoId);
        result.put("current_time", extrapolatedTime());
        result.put("is_playing", playing);
        result.put("playback_rate", playbackRate);
        result.put("server_timestamp", nowSeconds());
        return result;
    }

    private Map<String, Object> requestMaster(String identity) {
        if (hasLiveMaster()) {
            return Messages.error("Master control is held by " + masterUser);
        }
        assignMaster(identity);
        recordLastAction(identity, "request_master", nowSeconds());

        Map<String, Object> result = Messages.message("youtube_master_assigned");
        result.put("message", "You are now the master");
        return result;
    }

    // ========================================================================
    //  BUFFERING
    // ========================================================================

    private Map<String, Object> bufferStart(String identity) {
        if (bufferingUsers.isEmpty()) foldElapsed(nowSeconds());
        bufferingUsers.add(identity);
        cancelPendingResume();
        log.debug("Buffer start room={} user={} buffering={}", channel.roomId(), identity, bufferingUsers);

        if (playing) pause(identity);

        Map<String, Object> out = Messages.message("youtube_user_buffering");
        out.put("user_id", identity);
        out.put("buffering_count", bufferingUsers.size());
        broadcastExcept(out, identity);

        Map<String, Object> result = Messages.message("youtube_buffer_start");
        result.put("message", "Buffering started");
        return result;
    }

    private Map<String, Object> bufferEnd(String identity) {
        boolean removed = bufferingUsers.remove(identity);
        if (removed && bufferingUsers.isEmpty()) anchorTime = nowSeconds();
        log.debug("Buffer end room={} user={} remaining={}", channel.roomId(), identity, bufferingUsers);

        Map<String, Object> out = Messages.message("youtube_user_buffer_end");
        out.put("user_id", identity);
        out.put("buffering_count", bufferingUsers.size());
        broadcastExcept(out, identity);

        if (bufferingUsers.isEmpty() && masterUser != null && videoId != null) {
            cancelPendingResume();
            pendingResume = scheduleOnce(this::resumeAfterBuffering, settings.bufferGraceMs());
        }

        Map<String, Object> result = Messages.message("youtube_buffer_end");
        result.put("message", "Buffering ended");
        return result;
    }

    /**
     * Runs after the buffering grace delay. Resumes only if nobody started buffering again
     * and the master is still in the room.
     */
    void resumeAfterBuffering() {
        pendingResume = null;
        if (!bufferingUsers.isEmpty()) return;
        if (masterUser == null || !members.contains(masterUser)) {
            log.debug("Auto-resume skipped room={} (no master present)", channel.roomId());
            return;
        }
        if (videoId == null || playing) return;
        play(masterUser);
    }

    private void cancelPendingResume() {
        ScheduledFuture<?> f = pendingResume;
        pendingResume = null;
        if (f != null) f.cancel(false);
    }

    // ========================================================================
    //  STATE REPORTS / DRIFT
    // ========================================================================

    private Map<String, Object> stateReport(String identity, Map<String, Object> payload) {
        if (!identity.equals(authoritativeUser)) {
            return Messages.error("Only authoritative user can report state");
        }
        Double clientTimestamp = Messages.number(payload, "client_timestamp");
        if (clientTimestamp != null && clientTimestamp > 0 && clientTimestamp < lastActionTime) {
            log.debug("Stale state report rejected room={} user={} report={} lastAction={}",
                    channel.roomId(), identity, clientTimestamp, lastActionTime);
            Map<String, Object> rejected = Messages.message("state_report_rejected");
            rejected.put("message", "Stale state report");
            return rejected;
        }

        Double reportedTime = Messages.number(payload, "current_time");
        Boolean reportedPlaying = Messages.flag(payload, "is_playing");
        Double reportedRate = Messages.number(payload, "playback_rate");

        double now = nowSeconds();
        if (reportedTime != null && reportedTime >= 0) currentTime = reportedTime;
        if (reportedPlaying != null) playing = reportedPlaying;
        if (reportedRate != null && reportedRate > 0 && reportedRate <= settings.maxPlaybackRate()) {
            playbackRate = reportedRate;
        }
        anchorTime = now;
        lastStateUpdate = now;

        Map<String, Object> out = Messages.message("youtube_sync_update");
        out.put("video_id", videoId);
        out.put("current_time", currentTime);
        out.put("is_playing", playing);
        out.put("playback_rate", playbackRate);
        out.put("master_user", masterUser);
        out.put("authoritative_user", identity);
        out.put("server_timestamp", now);
        broadcastExcept(out, identity);

        return Messages.message("state_report_accepted");
    }

    /** Drift correction: re-extrapolate and broadcast when nobody refreshed the state recently. */
    void driftCheck() {
        double now = nowSeconds();
        if (!playing || !bufferingUsers.isEmpty() || videoId == null) return;
        if ((now - lastStateUpdate) * 1000.0 <= settings.staleStateMs()) return;

        foldElapsed(now);
        lastStateUpdate = now;

        Map<String, Object> out = Messages.message("youtube_sync_update");
        out.put("video_id", videoId);
        out.put("current_time", currentTime);
        out.put("is_playing", true);
        out.put("playback_rate", playbackRate);
        out.put("last_action_user", lastActionUser);
        out.put("server_timestamp", now);
        broadcast(out);
    }

    // ========================================================================
    //  MEMBERS / SNAPSHOT
    // ========================================================================

    @Override
    public void addMember(String identity) {
        super.addMember(identity);
        if (!masterElected && identity != null) {
            masterUser = identity;
            masterElected = true;
            log.debug("Master elected room={} master={} (first joiner)", channel.roomId(), identity);
        }
    }

    @Override
    public void removeMember(String identity) {
        super.removeMember(identity);
        if (bufferingUsers.remove(identity) && bufferingUsers.isEmpty()) anchorTime = nowSeconds();
        throttle.forget(identity);
        if (Objects.equals(masterUser, identity)) masterUser = null;
        if (Objects.equals(authoritativeUser, identity)) authoritativeUser = null;
    }

    @Override
    public Map<String, Object> snapshotFor(String identity) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("video_id", videoId);
        state.put("current_time", extrapolatedTime());
        state.put("is_playing", playing);
        state.put("playback_rate", playbackRate);
        state.put("last_action_user", lastActionUser);
        state.put("buffering_users", new ArrayList<>(bufferingUsers));
        state.put("is_buffering", bufferingUsers.contains(identity));
        state.put("last_action", lastAction);
        state.put("master_user", masterUser);
        state.put("authoritative_user", authoritativeUser);
        state.put("is_master", identity != null && identity.equals(masterUser));
        state.put("is_authoritative", identity != null && identity.equals(authoritativeUser));

        Map<String, Object> out = snapshotEnvelope(state);
        out.put("server_timestamp", nowSeconds());
        return out;
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    /** Offset now; extrapolated only while playing and nobody is buffering. */
    double extrapolatedTime() {
        if (!playing || !bufferingUsers.isEmpty()) return currentTime;
        return currentTime + (nowSeconds() - anchorTime) * playbackRate;
    }

    /** Moves the extrapolation anchor to {@code now}, folding elapsed playback into currentTime. */
    private void foldElapsed(double now) {
        if (playing && bufferingUsers.isEmpty()) {
            currentTime += (now - anchorTime) * playbackRate;
        }
        anchorTime = now;
    }

    private boolean hasLiveMaster() {
        return masterUser != null && members.contains(masterUser);
    }

    private void assignMaster(String identity) {
        masterUser = identity;
        masterElected = true;
        Map<String, Object> out = Messages.message("youtube_master_changed");
        out.put("new_master", identity);
        broadcast(out);
        log.info("Master changed room={} master={}", channel.roomId(), identity);
    }

    private void recordLastAction(String identity, String kind, double at) {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("user", identity);
        a.put("type", kind);
        a.put("timestamp", at);
        lastAction = a;
    }

    // package-private views for tests
    String getVideoId() { return videoId; }
    boolean isPlaying() { return playing; }
    double getPlaybackRate() { return playbackRate; }
    String getMasterUser() { return masterUser; }
    String getAuthoritativeUser() { return authoritativeUser; }
    Set<String> getBufferingUsers() { return Collections.unmodifiableSet(bufferingUsers); }
    int throttledIdentities() { return throttle.trackedIdentities(); }
}
