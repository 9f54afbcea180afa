package com.ergrace.infrastructure;

import com.ergrace.application.port.EventPublisher;
import com.ergrace.domain.CoordinatorEvent;
import com.ergrace.domain.CoordinatorEvent.Countdown;
import com.ergrace.domain.CoordinatorEvent.LobbyCreated;
import com.ergrace.domain.CoordinatorEvent.LobbyList;
import com.ergrace.domain.CoordinatorEvent.LobbyUpdated;
import com.ergrace.domain.CoordinatorEvent.RaceCompleted;
import com.ergrace.domain.CoordinatorEvent.RaceStarted;
import com.ergrace.domain.CoordinatorEvent.RaceUpdate;
import com.ergrace.dto.CountdownMessage;
import com.ergrace.dto.LobbyListMessage;
import com.ergrace.dto.LobbyMessage;
import com.ergrace.dto.RaceMessage;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/** Delivers core events to a single STOMP session on {@code /user/queue/events}. */
@Component
public class StompEventPublisher implements EventPublisher {
  static final String EVENTS = "/queue/events";

  private final SimpMessagingTemplate ws;

  public StompEventPublisher(SimpMessagingTemplate ws) {
    this.ws = ws;
  }

  @Override
  public void send(String sessionId, CoordinatorEvent event) {
    ws.convertAndSendToUser(sessionId, EVENTS, toMessage(event), headers(sessionId));
  }

  static Object toMessage(CoordinatorEvent e) {
    if (e instanceof LobbyCreated c) return new LobbyMessage(c.type(), c.lobby());
    if (e instanceof LobbyUpdated u) return new LobbyMessage(u.type(), u.lobby());
    if (e instanceof LobbyList l) return new LobbyListMessage(l.lobbies());
    if (e instanceof Countdown c) return new CountdownMessage(c.lobbyId(), c.raceId(), c.value());
    if (e instanceof RaceStarted s) return new RaceMessage(s.type(), s.race());
    if (e instanceof RaceUpdate u) return new RaceMessage(u.type(), u.race());
    if (e instanceof RaceCompleted c) return new RaceMessage(c.type(), c.race());
    throw new IllegalArgumentException("Unknown event " + e.type());
  }

  /** Session-addressed headers, so the user destination resolves without a principal. */
  private static MessageHeaders headers(String sessionId) {
    SimpMessageHeaderAccessor h = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
    h.setSessionId(sessionId);
    h.setLeaveMutable(true);
    return h.getMessageHeaders();
  }
}
