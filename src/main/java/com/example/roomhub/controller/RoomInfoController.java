package com.example.roomhub.controller;

import com.example.roomhub.service.RoomService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Read-only room and catalog lookups (same bodies as the WebSocket replies). */
@RestController
@RequestMapping("/api")
public class RoomInfoController {

    private final RoomService roomService;

    public RoomInfoController(RoomService roomService) {
        this.roomService = roomService;
    }

    @GetMapping("/activities")
    public List<Map<String, Object>> activities() {
        return roomService.availableActivities();
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<Map<String, Object>> room(@PathVariable String roomId) {
        Map<String, Object> info = roomService.roomInfo(roomId);
        return (info == null) ? ResponseEntity.notFound().build() : ResponseEntity.ok(info);
    }
}
