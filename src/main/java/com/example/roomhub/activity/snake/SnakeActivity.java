package com.example.roomhub.activity.snake;

import com.example.roomhub.activity.AbstractActivity;
import com.example.roomhub.activity.ActivityType;
import com.example.roomhub.activity.Messages;
import com.example.roomhub.activity.RoomChannel;
import com.example.roomhub.config.ActivityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Tick-driven multiplayer snake.
 * - waiting → playing by start_game (needs a player), any state → waiting by restart_game
 * - playing → finished when at most one snake survives among two or more players, or none survives
 * - every tick resolves all snakes against pre-move bodies, then broadcasts {@code snake_state}
 */
public class SnakeActivity extends AbstractActivity {

    private static final Logger log = LoggerFactory.getLogger(SnakeActivity.class);

    public enum Status {
        WAITING, PLAYING, FINISHED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final ActivityProperties.Snake settings;
    private final Random random;

    private final Map<String, Snake> players = new LinkedHashMap<>();
    private final List<Position> food = new ArrayList<>();

    private Status status = Status.WAITING;
    private long tickCount = 0;
    private String winner;

    public SnakeActivity(RoomChannel channel, Clock clock, long stopTimeoutMs,
                         ActivityProperties.Snake settings, Random random) {
        super(ActivityType.SNAKE, channel, clock, stopTimeoutMs);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    protected void onStart() {
        long periodMs = Math.max(1L, 1000L / settings.tickRate());
        scheduleRepeating(() -> {
            if (status == Status.PLAYING) tick();
        }, periodMs);
    }

    // ========================================================================
    //  ACTIONS
    // ========================================================================

    @Override
    public Map<String, Object> handleAction(String identity, String action, Map<String, Object> payload) {
        String kind = (action == null) ? "" : action;
        return switch (kind) {
            case "join_game" ->       joinGame(identity);
            case "change_direction" -> changeDirection(identity, payload);
            case "start_game" ->      startGame(identity);
            case "restart_game" ->    restartGame(identity);
            default ->                Messages.error("Unknown snake action: " + kind);
        };
    }

    private Map<String, Object> joinGame(String identity) {
        if (players.containsKey(identity)) return Messages.error("Already in game");
        if (players.size() >= settings.maxPlayers()) return Messages.error("Game is full");

        players.put(identity, new Snake(identity, spawnPosition(), Direction.RIGHT));
        if (players.size() == 1) {
            for (int i = 0; i < settings.initialFood(); i++) spawnFood();
        }
        log.debug("Snake joined room={} player={} players={}", channel.roomId(), identity, players.size());

        Map<String, Object> out = Messages.message("snake_player_joined");
        out.put("user_id", identity);
        out.put("player_count", players.size());
        broadcast(out);

        Map<String, Object> result = Messages.message("snake_joined");
        result.put("message", "Joined snake game");
        return result;
    }

    private Map<String, Object> changeDirection(String identity, Map<String, Object> payload) {
        Snake snake = players.get(identity);
        if (snake == null) return Messages.error("Not in game");

        String raw = Messages.text(payload, "direction");
        Optional<Direction> parsed = Direction.parse(raw);
        if (parsed.isEmpty()) {
            String shown = (raw == null) ? "" : raw.toUpperCase(Locale.ROOT);
            return Messages.error("Invalid direction: " + shown);
        }
        Direction next = parsed.get();
        if (next.isOpposite(snake.getDirection())) {
            return Messages.error("Cannot reverse direction");
        }
        snake.setDirection(next);

        Map<String, Object> result = Messages.message("snake_direction_changed");
        result.put("direction", next.name());
        return result;
    }

    private Map<String, Object> startGame(String identity) {
        if (status != Status.WAITING) return Messages.error("Game already started or finished");
        if (players.isEmpty()) return Messages.error("Need at least 1 player");

        status = Status.PLAYING;
        log.info("Snake game started room={} by={} players={}", channel.roomId(), identity, players.size());

        Map<String, Object> out = Messages.message("snake_game_started");
        out.put("player_count", players.size());
        broadcast(out);

        Map<String, Object> result = Messages.message("snake_game_started");
        result.put("message", "Game started");
        return result;
    }

    private Map<String, Object> restartGame(String identity) {
        status = Status.WAITING;
        tickCount = 0;
        winner = null;
        food.clear();

        List<String> ids = new ArrayList<>(players.keySet());
        players.clear();
        for (String id : ids) {
            players.put(id, new Snake(id, spawnPosition(), Direction.RIGHT));
        }
        for (int i = 0; i < settings.initialFood(); i++) spawnFood();
        log.info("Snake game restarted room={} by={}", channel.roomId(), identity);

        broadcast(Messages.message("snake_game_restarted"));

        Map<String, Object> result = Messages.message("snake_game_restarted");
        result.put("message", "Game restarted");
        return result;
    }

    // ========================================================================
    //  SIMULATION
    // ========================================================================

    /** One simulation step; the loop calls it only while playing. */
    void tick() {
        tickCount++;

        Map<String, List<Position>> preMove = new HashMap<>();
        for (Snake s : players.values()) preMove.put(s.getOwner(), s.getBody());

        for (Snake snake : players.values()) {
            if (!snake.isAlive()) continue;

            Position next = snake.nextHead();
            if (!next.inside(settings.gridWidth(), settings.gridHeight())) {
                snake.kill();
                continue;
            }
            if (preMove.get(snake.getOwner()).contains(next) || hitsOtherBody(snake.getOwner(), next, preMove)) {
                snake.kill();
                continue;
            }

            boolean ate = food.remove(next);
            snake.advance(next, ate);
            if (ate) {
                snake.addScore();
                spawnFood();
            }
        }

        resolveHeadOnCollisions();
        checkFinished();

        Map<String, Object> out = Messages.message("snake_state");
        out.put("state", stateMap());
        broadcast(out);
    }

    private static boolean hitsOtherBody(String owner, Position p, Map<String, List<Position>> preMove) {
        for (Map.Entry<String, List<Position>> e : preMove.entrySet()) {
            if (!e.getKey().equals(owner) && e.getValue().contains(p)) return true;
        }
        return false;
    }

    /** Snakes that moved their heads onto the same free cell all die. */
    private void resolveHeadOnCollisions() {
        Map<Position, List<Snake>> byHead = new HashMap<>();
        for (Snake s : players.values()) {
            if (s.isAlive()) byHead.computeIfAbsent(s.head(), k -> new ArrayList<>()).add(s);
        }
        for (List<Snake> group : byHead.values()) {
            if (group.size() > 1) group.forEach(Snake::kill);
        }
    }

    private void checkFinished() {
        if (status != Status.PLAYING) return;
        List<Snake> alive = new ArrayList<>();
        for (Snake s : players.values()) {
            if (s.isAlive()) alive.add(s);
        }
        boolean lastStanding = players.size() >= 2 && alive.size() <= 1;
        boolean allDead = !players.isEmpty() && alive.isEmpty();
        if (lastStanding || allDead) {
            status = Status.FINISHED;
            winner = (alive.size() == 1 && players.size() >= 2) ? alive.get(0).getOwner() : null;
            log.info("Snake game finished room={} winner={} ticks={}", channel.roomId(), winner, tickCount);
        }
    }

    private Position spawnPosition() {
        Position candidate = randomInset();
        for (int i = 1; i < settings.foodAttempts() && isOccupied(candidate); i++) {
            candidate = randomInset();
        }
        return candidate;
    }

    private Position randomInset() {
        return new Position(insetCoordinate(settings.gridWidth()), insetCoordinate(settings.gridHeight()));
    }

    private int insetCoordinate(int size) {
        int inset = Math.min(settings.spawnInset(), (size - 1) / 2);
        int span = Math.max(1, size - 2 * inset);
        return inset + random.nextInt(span);
    }

    /** Places one food item on a free cell, or none when every attempt hit an occupied cell. */
    private void spawnFood() {
        for (int i = 0; i < settings.foodAttempts(); i++) {
            Position p = new Position(random.nextInt(settings.gridWidth()), random.nextInt(settings.gridHeight()));
            if (!isOccupied(p)) {
                food.add(p);
                return;
            }
        }
        log.debug("Food placement gave up room={} after {} attempts", channel.roomId(), settings.foodAttempts());
    }

    private boolean isOccupied(Position p) {
        if (food.contains(p)) return true;
        for (Snake s : players.values()) {
            if (s.occupies(p)) return true;
        }
        return false;
    }

    // ========================================================================
    //  MEMBERS / SNAPSHOT
    // ========================================================================

    @Override
    public void removeMember(String identity) {
        super.removeMember(identity);
        if (players.remove(identity) != null) {
            Map<String, Object> out = Messages.message("snake_player_left");
            out.put("user_id", identity);
            out.put("player_count", players.size());
            broadcast(out);
        }
    }

    @Override
    public Map<String, Object> snapshotFor(String identity) {
        Map<String, Object> out = snapshotEnvelope(stateMap());
        out.put("is_player", players.containsKey(identity));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("grid_width", settings.gridWidth());
        config.put("grid_height", settings.gridHeight());
        config.put("tick_rate", settings.tickRate());
        config.put("max_players", settings.maxPlayers());
        out.put("config", config);
        return out;
    }

    private Map<String, Object> stateMap() {
        Map<String, Object> snakes = new LinkedHashMap<>();
        players.forEach((id, s) -> snakes.put(id, s.toMap()));

        List<Map<String, Object>> foodCells = new ArrayList<>(food.size());
        for (Position p : food) foodCells.add(p.toMap());

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("status", status.wireName());
        state.put("players", snakes);
        state.put("food", foodCells);
        state.put("tick_count", tickCount);
        state.put("winner", winner);
        return state;
    }

    // package-private views for tests
    Status getStatus() { return status; }
    String getWinner() { return winner; }
    Snake snakeOf(String identity) { return players.get(identity); }
    List<Position> getFood() { return Collections.unmodifiableList(food); }

    void putSnake(Snake snake) {
        players.put(snake.getOwner(), snake);
    }

    void placeFood(Position p) {
        food.add(p);
    }

    void clearFood() {
        food.clear();
    }
}
