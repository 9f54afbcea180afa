package com.ergrace.interfaces.rest;

import com.ergrace.application.RaceCoordinator;
import com.ergrace.application.RaceCoordinator.Entrant;
import com.ergrace.application.RaceCoordinator.LobbyTerms;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.dto.BotRequest;
import com.ergrace.dto.CreateLobbyRequest;
import com.ergrace.dto.ParticipantIdRequest;
import com.ergrace.dto.ParticipantRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Request/response lobby commands. Events still reach connected clients. */
@RestController
@RequestMapping("/api")
public class LobbyController {
  private final RaceCoordinator coordinator;

  public LobbyController(RaceCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @GetMapping("/lobbies")
  public List<LobbySnapshot> lobbies(@RequestParam(required = false) String userId) {
    return coordinator.listLobbies(null, userId);
  }

  @GetMapping("/lobby/{id}")
  public LobbySnapshot lobby(@PathVariable String id) {
    return coordinator.getLobby(id);
  }

  @PostMapping("/lobby")
  @ResponseStatus(HttpStatus.CREATED)
  public LobbySnapshot create(@Valid @RequestBody CreateLobbyRequest req) {
    return coordinator.createLobby(
        null,
        new LobbyTerms(
            req.creatorId(),
            req.raceDistance(),
            req.entryFee(),
            req.payoutMode(),
            req.maxParticipants(),
            req.minParticipants()));
  }

  @PostMapping("/lobby/{id}/join")
  public LobbySnapshot join(@PathVariable String id, @Valid @RequestBody ParticipantRequest req) {
    return coordinator.joinLobby(
        null, id, new Entrant(req.id(), req.displayName(), req.walletAddress(), req.equipmentType()));
  }

  @PostMapping("/lobby/{id}/bot")
  public LobbySnapshot bot(
      @PathVariable String id, @RequestBody(required = false) BotRequest req) {
    return coordinator.addBot(id, req == null ? null : req.difficulty()).lobby();
  }

  @PostMapping("/lobby/{id}/ready")
  public LobbySnapshot ready(
      @PathVariable String id, @Valid @RequestBody ParticipantIdRequest req) {
    return coordinator.setReady(id, req.participantId());
  }

  @PostMapping("/lobby/{id}/leave")
  public LobbySnapshot leave(
      @PathVariable String id, @Valid @RequestBody ParticipantIdRequest req) {
    return coordinator.leaveLobby(null, id, req.participantId());
  }

  @PostMapping("/lobby/{id}/start")
  public RaceSnapshot start(@PathVariable String id) {
    return coordinator.startRace(id);
  }

  @PostMapping("/lobby/{id}/cancel")
  public LobbySnapshot cancel(@PathVariable String id, @RequestParam String requesterId) {
    return coordinator.cancelLobby(id, requesterId);
  }
}
