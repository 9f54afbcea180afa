package com.ergrace.interfaces.rest;

import com.ergrace.application.RaceCoordinator;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.dto.ParticipantMetricsRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/race")
public class RaceController {
  private final RaceCoordinator coordinator;

  public RaceController(RaceCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @PostMapping("/{id}/update")
  public RaceSnapshot update(
      @PathVariable String id, @Valid @RequestBody ParticipantMetricsRequest req) {
    return coordinator.reportMetrics(
        id, req.participantId(), req.distance(), req.pace(), req.watts());
  }

  @GetMapping("/{id}")
  public RaceSnapshot race(@PathVariable String id) {
    return coordinator.getRace(id);
  }
}
