package com.ergrace.interfaces.rest;

import com.ergrace.domain.Race;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Client-facing limits, so a client does not have to hard-code them. */
@RestController
public class ConfigController {
  private final int minParticipants;
  private final int maxParticipants;
  private final long countdownIntervalMs;

  public ConfigController(
      @Value("${ergrace.lobby.default-min-participants:2}") int minParticipants,
      @Value("${ergrace.lobby.default-max-participants:10}") int maxParticipants,
      @Value("${ergrace.race.countdown-interval-ms:1000}") long countdownIntervalMs) {
    this.minParticipants = minParticipants;
    this.maxParticipants = maxParticipants;
    this.countdownIntervalMs = countdownIntervalMs;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "minParticipants", minParticipants,
        "maxParticipants", maxParticipants,
        "countdownFrom", Race.COUNTDOWN_FROM,
        "countdownIntervalMs", countdownIntervalMs,
        "maxPace", 600,
        "maxWatts", 2000,
        "protocolVersion", 1);
  }
}
