package com.example.roomhub.controller;

import com.example.roomhub.activity.ActivityType;
import com.example.roomhub.service.RoomService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Standalone MVC test: no Spring context, no @MockBean.
 */
class RoomInfoControllerTest {

    private MockMvc mockMvcWith(RoomService roomService) {
        return MockMvcBuilders
                .standaloneSetup(new RoomInfoController(roomService), new HealthController(roomService))
                .build();
    }

    @Test
    void roomInfo_returnsBody_whenRoomExists() throws Exception {
        RoomService roomService = Mockito.mock(RoomService.class);
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", "room_info");
        info.put("room_id", "team-x");
        info.put("host", "alice");
        info.put("current_activity", "youtube");
        info.put("user_count", 2);
        when(roomService.roomInfo("team-x")).thenReturn(info);

        mockMvcWith(roomService).perform(get("/api/rooms/{roomId}", "team-x"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room_id", is("team-x")))
                .andExpect(jsonPath("$.host", is("alice")))
                .andExpect(jsonPath("$.user_count", is(2)));
    }

    @Test
    void roomInfo_returns404_whenRoomDoesNotExist() throws Exception {
        RoomService roomService = Mockito.mock(RoomService.class);
        when(roomService.roomInfo("nope")).thenReturn(null);

        mockMvcWith(roomService).perform(get("/api/rooms/{roomId}", "nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void activities_listsCatalog() throws Exception {
        RoomService roomService = Mockito.mock(RoomService.class);
        List<Map<String, Object>> catalog = List.of(ActivityType.YOUTUBE.describe(), ActivityType.SNAKE.describe());
        when(roomService.availableActivities()).thenReturn(catalog);

        mockMvcWith(roomService).perform(get("/api/activities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].type", is("snake")));
    }

    @Test
    void healthz_isOk() throws Exception {
        mockMvcWith(Mockito.mock(RoomService.class)).perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(content().string("ok"));
    }
}
