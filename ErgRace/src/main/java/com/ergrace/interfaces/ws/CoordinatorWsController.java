package com.ergrace.interfaces.ws;

import com.ergrace.application.RaceCoordinator;
import com.ergrace.application.RaceCoordinator.Entrant;
import com.ergrace.application.RaceCoordinator.LobbyTerms;
import com.ergrace.application.RaceCoordinator.Rejoined;
import com.ergrace.dto.AddBotRequest;
import com.ergrace.dto.CancelLobbyRequest;
import com.ergrace.dto.CreateLobbyRequest;
import com.ergrace.dto.ErrorMessage;
import com.ergrace.dto.IdentifyRequest;
import com.ergrace.dto.JoinLobbyRequest;
import com.ergrace.dto.LobbyListMessage;
import com.ergrace.dto.LobbyListRequest;
import com.ergrace.dto.LobbyRequest;
import com.ergrace.dto.ParticipantActionRequest;
import com.ergrace.dto.ParticipantRequest;
import com.ergrace.dto.RaceUpdateRequest;
import com.ergrace.dto.RejoinMessage;
import jakarta.validation.Valid;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

/**
 * Persistent transport. Commands arrive on {@code /app/*}; state changes flow back as events,
 * and only rejoin, the lobby list query and errors are answered directly.
 */
@Validated
@Controller
public class CoordinatorWsController {
  static final String EVENTS_DESTINATION = "/user/queue/events";

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final RaceCoordinator coordinator;

  public CoordinatorWsController(RaceCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @MessageMapping("/identify")
  public void identify(@Valid IdentifyRequest req, @Header("simpSessionId") String sid) {
    coordinator.identify(sid, req.userId());
  }

  @MessageMapping("/getLobbies")
  @SendToUser("/queue/events")
  public LobbyListMessage lobbies(
      @Payload(required = false) LobbyListRequest req,
      @Header("simpSessionId") String sid) {
    return new LobbyListMessage(coordinator.listLobbies(sid, req == null ? null : req.userId()));
  }

  @MessageMapping("/createLobby")
  public void create(@Valid CreateLobbyRequest req, @Header("simpSessionId") String sid) {
    coordinator.createLobby(
        sid,
        new LobbyTerms(
            req.creatorId(),
            req.raceDistance(),
            req.entryFee(),
            req.payoutMode(),
            req.maxParticipants(),
            req.minParticipants()));
  }

  @MessageMapping("/joinLobby")
  public void join(@Valid JoinLobbyRequest req, @Header("simpSessionId") String sid) {
    coordinator.joinLobby(sid, req.lobbyId(), entrant(req.participant()));
  }

  @MessageMapping("/addBot")
  public void addBot(@Valid AddBotRequest req) {
    coordinator.addBot(req.lobbyId(), req.difficulty());
  }

  @MessageMapping("/setReady")
  public void ready(@Valid ParticipantActionRequest req) {
    coordinator.setReady(req.lobbyId(), req.participantId());
  }

  @MessageMapping("/leaveLobby")
  public void leave(@Valid ParticipantActionRequest req, @Header("simpSessionId") String sid) {
    coordinator.leaveLobby(sid, req.lobbyId(), req.participantId());
  }

  @MessageMapping("/rejoin")
  @SendToUser("/queue/reply")
  public RejoinMessage rejoin(@Valid LobbyRequest req, @Header("simpSessionId") String sid) {
    Rejoined r = coordinator.rejoin(sid, req.lobbyId());
    return new RejoinMessage(r.lobby(), r.race());
  }

  @MessageMapping("/startRace")
  public void start(@Valid LobbyRequest req) {
    coordinator.startRace(req.lobbyId());
  }

  @MessageMapping("/raceUpdate")
  public void raceUpdate(@Valid RaceUpdateRequest req) {
    coordinator.reportMetrics(
        req.raceId(),
        req.participantId(),
        req.metrics().distance(),
        req.metrics().pace(),
        req.metrics().watts());
  }

  @MessageMapping("/cancelLobby")
  public void cancel(@Valid CancelLobbyRequest req) {
    coordinator.cancelLobby(req.lobbyId(), req.requesterId());
  }

  @MessageExceptionHandler(Exception.class)
  @SendToUser("/queue/reply")
  public ErrorMessage onError(Exception e) {
    log.debug("Command rejected: {}", e.getMessage());
    return new ErrorMessage(reason(e), message(e));
  }

  @EventListener
  public void onConnect(SessionConnectedEvent e) {
    coordinator.connected(StompHeaderAccessor.wrap(e.getMessage()).getSessionId());
  }

  @EventListener
  public void onSubscribe(SessionSubscribeEvent e) {
    StompHeaderAccessor h = StompHeaderAccessor.wrap(e.getMessage());
    if (EVENTS_DESTINATION.equals(h.getDestination())) {
      coordinator.subscribed(h.getSessionId());
    }
  }

  @EventListener
  public void onDisconnect(SessionDisconnectEvent e) {
    coordinator.disconnected(e.getSessionId());
  }

  static Entrant entrant(ParticipantRequest p) {
    return new Entrant(p.id(), p.displayName(), p.walletAddress(), p.equipmentType());
  }

  static String reason(Exception e) {
    if (e instanceof NoSuchElementException) return "not_found";
    if (e instanceof IllegalStateException) return "conflict";
    if (e instanceof IllegalArgumentException || e instanceof MethodArgumentNotValidException) {
      return "invalid";
    }
    return "error";
  }

  private static String message(Exception e) {
    if (e instanceof MethodArgumentNotValidException) return "Invalid request";
    return e.getMessage();
  }
}
