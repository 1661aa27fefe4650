package com.example.roomhub.activity;

import com.example.roomhub.activity.snake.SnakeActivity;
import com.example.roomhub.config.ActivityProperties;
import com.example.roomhub.support.RecordingChannel;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/** Background loop lifecycle, using the snake tick loop with real time. */
class ActivityLoopTest {

    private final RecordingChannel channel = new RecordingChannel("loop");
    private final SnakeActivity game = new SnakeActivity(channel, Clock.systemUTC(), 1000L,
            new ActivityProperties.Snake(200, 200, 60, 8, 0, 2, 100), new Random(7));

    private void awaitStates(int atLeast) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (channel.ofType("snake_state").size() < atLeast && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void loopTicksWhilePlayingAndStopsForGood() throws Exception {
        game.start();
        assertTrue(game.isRunning());

        synchronized (channel.mutex()) {
            game.handleAction("alice", "join_game", Map.of());
            game.handleAction("alice", "start_game", Map.of());
        }
        awaitStates(2);
        assertTrue(channel.ofType("snake_state").size() >= 2, "loop should have ticked");

        game.stop();
        assertFalse(game.isRunning());

        int afterStop = channel.ofType("snake_state").size();
        Thread.sleep(100);
        assertEquals(afterStop, channel.ofType("snake_state").size(), "no tick may run after stop()");
    }

    @Test
    void stopIsIdempotentAndSafeBeforeStart() {
        game.stop();
        game.start();
        game.stop();
        game.stop();
        assertFalse(game.isRunning());
    }

    @Test
    void waitingGameDoesNotTick() throws Exception {
        game.start();
        Thread.sleep(80);
        game.stop();
        assertTrue(channel.ofType("snake_state").isEmpty());
    }
}
