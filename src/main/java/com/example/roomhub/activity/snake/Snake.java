package com.example.roomhub.activity.snake;

import java.util.*;

/** One player's snake; body is ordered head first. */
public class Snake {

    private final String owner;
    private final Deque<Position> body = new ArrayDeque<>();
    private Direction direction;
    private boolean alive = true;
    private int score = 0;

    public Snake(String owner, Position head, Direction direction) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.direction = Objects.requireNonNull(direction, "direction");
        body.add(Objects.requireNonNull(head, "head"));
    }

    public String getOwner() { return owner; }
    public Direction getDirection() { return direction; }
    public void setDirection(Direction direction) { this.direction = direction; }
    public boolean isAlive() { return alive; }
    public void kill() { this.alive = false; }
    public int getScore() { return score; }
    public void addScore() { this.score++; }

    public Position head() {
        return body.peekFirst();
    }

    public Position nextHead() {
        return head().step(direction);
    }

    public boolean occupies(Position p) {
        return body.contains(p);
    }

    /** Prepends the head; the tail stays when the snake just ate. */
    public void advance(Position newHead, boolean grow) {
        body.addFirst(newHead);
        if (!grow) body.removeLast();
    }

    public List<Position> getBody() {
        return new ArrayList<>(body);
    }

    public int length() {
        return body.size();
    }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> cells = new ArrayList<>(body.size());
        for (Position p : body) cells.add(p.toMap());

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("positions", cells);
        m.put("direction", direction.name());
        m.put("alive", alive);
        m.put("score", score);
        return m;
    }
}
