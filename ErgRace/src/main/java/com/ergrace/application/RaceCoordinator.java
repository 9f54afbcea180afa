package com.ergrace.application;

import com.ergrace.application.LobbyRegistry.BotAdded;
import com.ergrace.domain.BotDifficulty;
import com.ergrace.domain.CoordinatorEvent.LobbyCreated;
import com.ergrace.domain.CoordinatorEvent.LobbyUpdated;
import com.ergrace.domain.CoordinatorEvent.RaceUpdate;
import com.ergrace.domain.EquipmentType;
import com.ergrace.domain.LobbyParticipant;
import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.PayoutMode;
import com.ergrace.domain.ProfileUpdate;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.RaceStatus;
import com.ergrace.domain.UserProfile;
import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Command surface of the coordinator, shared by the STOMP and REST transports.
 *
 * <p>Every command validates, mutates the registry or the engine, then notifies subscribers
 * through the {@link EventBroadcaster} and fires the matching record-store trigger. Both happen
 * off the calling thread. {@code sessionId} is the caller's live connection, or null for a
 * request/response caller; only live connections are put in rooms.
 *
 * <p>Rejections surface as {@link NoSuchElementException}, {@link IllegalStateException} or
 * {@link IllegalArgumentException}; nothing here is fatal to the process.
 */
@Service
public class RaceCoordinator {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final LobbyRegistry lobbies;
  private final RaceEngine engine;
  private final EventBroadcaster events;
  private final RecordSync records;
  private final Clock clock;
  private final int defaultMaxParticipants;
  private final int defaultMinParticipants;

  public RaceCoordinator(
      LobbyRegistry lobbies,
      RaceEngine engine,
      EventBroadcaster events,
      RecordSync records,
      Clock clock,
      @Value("${ergrace.lobby.default-max-participants:10}") int defaultMaxParticipants,
      @Value("${ergrace.lobby.default-min-participants:2}") int defaultMinParticipants) {
    this.lobbies = lobbies;
    this.engine = engine;
    this.events = events;
    this.records = records;
    this.clock = clock;
    this.defaultMaxParticipants = defaultMaxParticipants;
    this.defaultMinParticipants = defaultMinParticipants;
  }

  /** Terms of a new lobby; null optional fields take the configured defaults. */
  public record LobbyTerms(
      String creatorId,
      int raceDistance,
      String entryFee,
      PayoutMode payoutMode,
      Integer maxParticipants,
      Integer minParticipants) {}

  /** Who is joining; equipment defaults to a rower. */
  public record Entrant(
      String id, String displayName, String walletAddress, EquipmentType equipmentType) {}

  /** Answer to a rejoin: the lobby and, if one was spawned, its race. */
  public record Rejoined(LobbySnapshot lobby, RaceSnapshot race) {}

  public record ServerStatus(int lobbies, int races, int sessions) {}

  /** Recover lobbies that were still waiting when the record store last saw them. */
  @EventListener(ApplicationReadyEvent.class)
  public void recoverWaitingLobbies() {
    List<LobbyRecord> waiting = records.waitingLobbies();
    waiting.forEach(lobbies::restore);
    if (!waiting.isEmpty()) {
      log.info("Recovered {} waiting lobbies", waiting.size());
    }
  }

  public void connected(String sessionId) {
    events.connect(sessionId);
  }

  /** A connection is ready for events: push its lobby list. */
  public void subscribed(String sessionId) {
    events.connect(sessionId);
    events.sendLobbyList(sessionId);
  }

  /** Attach a user id to a live connection; its lobby lists are filtered from now on. */
  public List<LobbySnapshot> identify(String sessionId, String userId) {
    events.identify(sessionId, userId);
    events.sendLobbyList(sessionId);
    return events.visibleTo(sessionId);
  }

  /**
   * Lobby list for a caller.
   *
   * @param userId filter to lobbies the user created or joined; null for every open lobby, or,
   *     on a live connection, for whatever that connection identified itself as
   */
  public List<LobbySnapshot> listLobbies(String sessionId, String userId) {
    if (sessionId == null) {
      return lobbies.listVisible(userId);
    }
    if (userId != null) {
      events.identify(sessionId, userId);
    }
    return events.visibleTo(sessionId);
  }

  public LobbySnapshot createLobby(String sessionId, LobbyTerms terms) {
    LobbySnapshot lobby =
        lobbies.createLobby(
            terms.creatorId(),
            terms.raceDistance(),
            terms.entryFee(),
            terms.payoutMode(),
            terms.maxParticipants() == null ? defaultMaxParticipants : terms.maxParticipants(),
            terms.minParticipants() == null ? defaultMinParticipants : terms.minParticipants());

    events.joinRoom(sessionId, lobby.id());
    events.toSession(sessionId, new LobbyCreated(lobby));
    events.refreshLobbyLists();
    records.lobbyCreated(lobby);
    return lobby;
  }

  public LobbySnapshot joinLobby(String sessionId, String lobbyId, Entrant entrant) {
    if (entrant == null || entrant.id() == null || entrant.id().isBlank()) {
      throw new IllegalArgumentException("Participant id is required");
    }
    LobbyParticipant p =
        LobbyParticipant.human(
            entrant.id(),
            entrant.displayName() == null ? entrant.id() : entrant.displayName(),
            entrant.walletAddress(),
            entrant.equipmentType(),
            clock.instant());
    LobbySnapshot lobby = lobbies.addParticipant(lobbyId, p);

    events.joinRoom(sessionId, lobbyId);
    events.toRoom(lobbyId, new LobbyUpdated(lobby));
    events.refreshLobbyLists();
    records.lobbyStatusChanged(lobby);
    return lobby;
  }

  public BotAdded addBot(String lobbyId, BotDifficulty difficulty) {
    BotAdded added = lobbies.addBot(lobbyId, difficulty);

    events.toRoom(lobbyId, new LobbyUpdated(added.lobby()));
    events.refreshLobbyLists();
    records.lobbyStatusChanged(added.lobby());
    return added;
  }

  public LobbySnapshot setReady(String lobbyId, String participantId) {
    LobbySnapshot lobby =
        lobbies.setReady(lobbyId, participantId).orElseThrow(RaceCoordinator::lobbyNotFound);
    events.toRoom(lobbyId, new LobbyUpdated(lobby));
    return lobby;
  }

  public LobbySnapshot leaveLobby(String sessionId, String lobbyId, String participantId) {
    LobbySnapshot lobby =
        lobbies.removeParticipant(lobbyId, participantId)
            .orElseThrow(RaceCoordinator::lobbyNotFound);

    events.leaveRoom(sessionId, lobbyId);
    events.toRoom(lobbyId, new LobbyUpdated(lobby));
    events.refreshLobbyLists();
    records.lobbyStatusChanged(lobby);
    return lobby;
  }

  /**
   * Put a connection back into a lobby's room and bring it up to date. The connection is also
   * sent the lobby and, when there is one, the race, as regular events.
   */
  public Rejoined rejoin(String sessionId, String lobbyId) {
    LobbySnapshot lobby = lobbies.find(lobbyId).orElseThrow(RaceCoordinator::lobbyNotFound);
    RaceSnapshot race = engine.raceFor(lobbyId).orElse(null);

    events.joinRoom(sessionId, lobbyId);
    events.toSession(sessionId, new LobbyUpdated(lobby));
    if (race != null) {
      events.toSession(sessionId, new RaceUpdate(race));
    }
    log.debug("Session {} rejoined lobby {}", sessionId, lobbyId);
    return new Rejoined(lobby, race);
  }

  public RaceSnapshot startRace(String lobbyId) {
    RaceSnapshot race = engine.start(lobbyId);
    events.refreshLobbyLists();
    records.lobbyStatusChanged(
        lobbies.find(lobbyId).orElseThrow(RaceCoordinator::lobbyNotFound));
    return race;
  }

  /**
   * Cancel a lobby on behalf of its creator, aborting its race if one is counting down or
   * running.
   *
   * <p>The race is aborted before the lobby is touched. Once aborted it can no longer complete,
   * and a race that already claimed completion keeps its lobby.
   *
   * @throws IllegalStateException if the requester is not the creator, the lobby already ended
   *     or its race already completed
   */
  public LobbySnapshot cancelLobby(String lobbyId, String requesterId) {
    LobbySnapshot current = getLobby(lobbyId);
    if (current.raceId() != null && current.creatorId().equals(requesterId)) {
      RaceSnapshot race = engine.abort(current.raceId()).orElse(null);
      if (race != null && race.status() == RaceStatus.COMPLETED) {
        throw new IllegalStateException("Race already completed");
      }
    }
    LobbySnapshot lobby = lobbies.cancel(lobbyId, requesterId);
    if (lobby.raceId() != null) {
      engine.abort(lobby.raceId());
    }
    events.toRoom(lobbyId, new LobbyUpdated(lobby));
    events.refreshLobbyLists();
    records.lobbyStatusChanged(lobby);
    return lobby;
  }

  public RaceSnapshot reportMetrics(
      String raceId, String participantId, double distance, double pace, double watts) {
    return engine.recordMetrics(raceId, participantId, distance, pace, watts);
  }

  public LobbySnapshot getLobby(String lobbyId) {
    return lobbies.find(lobbyId).orElseThrow(RaceCoordinator::lobbyNotFound);
  }

  public RaceSnapshot getRace(String raceId) {
    return engine.find(raceId).orElseThrow(() -> new NoSuchElementException("Race not found"));
  }

  public Optional<UserProfile> fetchProfile(String userId) {
    return records.fetchProfile(userId);
  }

  public Optional<UserProfile> saveProfile(String userId, ProfileUpdate update) {
    return records.saveProfile(userId, update);
  }

  /** Connection closed: it leaves its rooms, its user stays on every roster. */
  public void disconnected(String sessionId) {
    events.disconnect(sessionId);
  }

  public ServerStatus status() {
    return new ServerStatus(lobbies.size(), engine.size(), events.sessionCount());
  }

  private static NoSuchElementException lobbyNotFound() {
    return new NoSuchElementException("Lobby not found");
  }
}
