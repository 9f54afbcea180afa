package com.ergrace.interfaces.rest;

import com.ergrace.application.RaceCoordinator;
import com.ergrace.application.RaceCoordinator.ServerStatus;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {
  private final RaceCoordinator coordinator;

  public StatusController(RaceCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @GetMapping("/")
  public Map<String, Object> status() {
    ServerStatus s = coordinator.status();
    return Map.of(
        "name", "ErgRace",
        "status", "running",
        "lobbies", s.lobbies(),
        "races", s.races(),
        "sessions", s.sessions());
  }
}
