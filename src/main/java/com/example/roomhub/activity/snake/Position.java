package com.example.roomhub.activity.snake;

import java.util.LinkedHashMap;
import java.util.Map;

/** Grid cell. Origin is the top-left corner. */
public record Position(int x, int y) {

    public Position step(Direction d) {
        return new Position(x + d.dx(), y + d.dy());
    }

    public boolean inside(int width, int height) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("x", x);
        m.put("y", y);
        return m;
    }
}
