package com.example.roomhub.controller;

import com.example.roomhub.service.RoomService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomService roomService;

  public HealthController(RoomService roomService) {
    this.roomService = roomService;
  }

  /** Liveness check without touching room state. */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("message", "WebSocket server is running");
    m.put("rooms", roomService.roomCount());
    return m;
  }
}
