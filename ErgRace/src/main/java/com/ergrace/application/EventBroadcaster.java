package com.ergrace.application;

import com.ergrace.application.port.EventPublisher;
import com.ergrace.domain.ClientSession;
import com.ergrace.domain.CoordinatorEvent;
import com.ergrace.domain.CoordinatorEvent.LobbyList;
import com.ergrace.domain.LobbySnapshot;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fan-out of core events to connected clients.
 *
 * <p>Keeps explicit per-connection state ({@link ClientSession}) and the reverse index of lobby
 * rooms. Every delivery is handed to the dispatch executor, so the thread that mutated state
 * never waits on a subscriber; with a single dispatch thread each connection sees events in the
 * order they were produced.
 */
@Service
public class EventBroadcaster {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
  /** Lobby id to the connections currently in that lobby's room. */
  private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

  private final EventPublisher publisher;
  private final LobbyRegistry lobbies;
  private final Executor dispatch;
  private final boolean filterByUser;

  public EventBroadcaster(
      EventPublisher publisher,
      LobbyRegistry lobbies,
      @Qualifier("broadcastExecutor") Executor dispatch,
      @Value("${ergrace.lobby-list.filter-by-user:true}") boolean filterByUser) {
    this.publisher = publisher;
    this.lobbies = lobbies;
    this.dispatch = dispatch;
    this.filterByUser = filterByUser;
  }

  public ClientSession connect(String sessionId) {
    return sessions.computeIfAbsent(sessionId, ClientSession::new);
  }

  /** Forget the connection. Roster membership of its user is untouched. */
  public void disconnect(String sessionId) {
    ClientSession s = sessions.remove(sessionId);
    if (s == null) return;
    s.rooms().forEach(lobbyId -> leaveRoom(sessionId, lobbyId));
    log.debug("Session {} disconnected", sessionId);
  }

  public void identify(String sessionId, String userId) {
    connect(sessionId).userId(userId);
  }

  public Optional<ClientSession> session(String sessionId) {
    return Optional.ofNullable(sessionId == null ? null : sessions.get(sessionId));
  }

  public void joinRoom(String sessionId, String lobbyId) {
    if (sessionId == null) return;
    connect(sessionId).rooms().add(lobbyId);
    rooms.computeIfAbsent(lobbyId, k -> ConcurrentHashMap.newKeySet()).add(sessionId);
  }

  public void leaveRoom(String sessionId, String lobbyId) {
    if (sessionId == null) return;
    ClientSession s = sessions.get(sessionId);
    if (s != null) s.rooms().remove(lobbyId);
    rooms.computeIfPresent(lobbyId, (k, members) -> {
      members.remove(sessionId);
      return members.isEmpty() ? null : members;
    });
  }

  public int sessionCount() {
    return sessions.size();
  }

  public Set<String> roomMembers(String lobbyId) {
    return Set.copyOf(rooms.getOrDefault(lobbyId, Set.of()));
  }

  public void toSession(String sessionId, CoordinatorEvent event) {
    if (sessionId == null) return;
    dispatch.execute(() -> deliver(sessionId, event));
  }

  public void toRoom(String lobbyId, CoordinatorEvent event) {
    Set<String> members = roomMembers(lobbyId);
    if (members.isEmpty()) return;
    dispatch.execute(() -> members.forEach(sid -> deliver(sid, event)));
  }

  /** Send one connection its own view of the lobby list. */
  public void sendLobbyList(String sessionId) {
    if (sessionId == null) return;
    dispatch.execute(() -> deliver(sessionId, new LobbyList(visibleTo(sessionId))));
  }

  /**
   * Recompute and resend the lobby list to every connection. Lists are computed on the dispatch
   * thread, per recipient, so each one reflects the state at delivery time.
   */
  public void refreshLobbyLists() {
    dispatch.execute(() -> {
      List<String> targets = List.copyOf(sessions.keySet());
      for (String sid : targets) {
        deliver(sid, new LobbyList(visibleTo(sid)));
      }
    });
  }

  /** Lobby list for one connection: filtered once it has identified itself. */
  List<LobbySnapshot> visibleTo(String sessionId) {
    ClientSession s = sessions.get(sessionId);
    String userId = filterByUser && s != null && s.identified() ? s.userId() : null;
    return lobbies.listVisible(userId);
  }

  private void deliver(String sessionId, CoordinatorEvent event) {
    try {
      publisher.send(sessionId, event);
    } catch (RuntimeException e) {
      log.warn("Dropping {} for session {}: {}", event.type(), sessionId, e.getMessage());
    }
  }
}
