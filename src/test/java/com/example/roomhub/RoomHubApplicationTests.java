package com.example.roomhub;

import com.example.roomhub.activity.ActivityRegistry;
import com.example.roomhub.activity.ActivityType;
import com.example.roomhub.config.ActivityProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "activities.snake.tick-rate=15",
        "activities.sync.throttle-seconds[seek]=2.5"
})
class RoomHubApplicationTests {

    @Autowired
    private ActivityProperties properties;

    @Autowired
    private ActivityRegistry registry;

    @Test
    void bindsActivityProperties() {
        assertEquals("youtube", properties.defaultType());
        assertEquals(2000L, properties.stopTimeoutMs());
        assertEquals(15, properties.snake().tickRate());
        assertEquals(20, properties.snake().gridWidth());
        assertEquals(2.5, properties.sync().throttleSeconds().get("seek"), 1e-9);
        assertEquals(3.0, properties.sync().throttleSeconds().get("load_video"), 1e-9);
        assertEquals(ActivityType.YOUTUBE, registry.defaultType());
    }
}
