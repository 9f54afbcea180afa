package com.ergrace.application;

import com.ergrace.domain.BotDifficulty;
import com.ergrace.domain.EquipmentType;
import com.ergrace.domain.Lobby;
import com.ergrace.domain.LobbyParticipant;
import com.ergrace.domain.LobbyParticipantSnapshot;
import com.ergrace.domain.LobbyRecord;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.LobbyStatus;
import com.ergrace.domain.ParticipantStatus;
import com.ergrace.domain.PayoutMode;
import com.ergrace.domain.RaceParticipantSnapshot;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory registry of lobbies.
 *
 * <p>Lobbies live in a concurrent map; every mutation of a single lobby happens under that
 * lobby's {@link java.util.concurrent.locks.ReentrantLock}, so capacity and status checks and the
 * change they guard are atomic. Methods hand out {@link LobbySnapshot}s, never the live entity,
 * except {@link #require(String)} which the race engine uses to spawn a race under the same lock.
 *
 * <p>Rejections are thrown: {@link NoSuchElementException} for an unknown lobby, {@link
 * IllegalStateException} for a full lobby or a wrong-state transition, {@link
 * IllegalArgumentException} for bad lobby terms.
 */
@Service
public class LobbyRegistry {
  static final List<String> BOT_NAMES =
      List.of(
          "RoboRower", "CyberSki", "BikeBotX", "IronPull", "SteelStroke",
          "TurboErg", "MechRacer", "AlphaBot", "BetaRow", "GammaGlide",
          "DeltaDrive", "EpsilonErg", "ZetaZoom", "ThetaThrust", "OmegaOar");

  private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d+)?");

  private final Logger log = LoggerFactory.getLogger(getClass());

  /** All lobbies keyed by id, including completed and cancelled ones. */
  private final Map<String, Lobby> lobbies = new ConcurrentHashMap<>();

  private final Random random;
  private final Clock clock;

  public LobbyRegistry(Random random, Clock clock) {
    this.random = random;
    this.clock = clock;
  }

  public record BotAdded(LobbySnapshot lobby, LobbyParticipantSnapshot bot) {}

  /**
   * Register a new waiting lobby with an empty roster.
   *
   * @throws IllegalArgumentException unless distance is positive, 2 <= min <= max and the fee is
   *     a non-negative decimal string
   */
  public LobbySnapshot createLobby(
      String creatorId,
      int raceDistance,
      String entryFee,
      PayoutMode payoutMode,
      int maxParticipants,
      int minParticipants) {
    if (creatorId == null || creatorId.isBlank()) {
      throw new IllegalArgumentException("creatorId is required");
    }
    if (raceDistance <= 0) {
      throw new IllegalArgumentException("Race distance must be positive");
    }
    if (minParticipants < 2 || minParticipants > maxParticipants) {
      throw new IllegalArgumentException("Need 2 <= minParticipants <= maxParticipants");
    }
    String fee = entryFee == null || entryFee.isBlank() ? "0" : entryFee.trim();
    if (!DECIMAL.matcher(fee).matches()) {
      throw new IllegalArgumentException("Entry fee must be a decimal string");
    }

    Lobby lobby =
        new Lobby(
            UUID.randomUUID().toString(),
            creatorId,
            raceDistance,
            fee,
            payoutMode == null ? PayoutMode.WINNER_TAKES_ALL : payoutMode,
            maxParticipants,
            minParticipants,
            clock.instant());
    lobbies.put(lobby.id(), lobby);
    log.info("Lobby {} created by {} ({} m, {}-{} racers)",
        lobby.id(), creatorId, raceDistance, minParticipants, maxParticipants);
    return withLock(lobby, lobby::snapshot);
  }

  /** Put a recovered lobby back; its roster starts empty. Existing ids are left alone. */
  public void restore(LobbyRecord r) {
    Lobby lobby =
        new Lobby(
            r.id(),
            r.creatorId(),
            r.raceDistance(),
            r.entryFee(),
            r.payoutMode(),
            r.maxParticipants(),
            r.minParticipants(),
            r.createdAt());
    lobbies.putIfAbsent(r.id(), lobby);
  }

  /**
   * Add a human participant.
   *
   * <p>A participant already on the roster gets the lobby back unchanged, whatever the lobby's
   * state, so a client reconnecting after a drop can simply join again.
   *
   * @throws NoSuchElementException if the lobby does not exist
   * @throws IllegalStateException if the lobby is not waiting or is full
   */
  public LobbySnapshot addParticipant(String lobbyId, LobbyParticipant participant) {
    Lobby lobby = require(lobbyId);
    lobby.lock().lock();
    try {
      if (lobby.participant(participant.id()).isPresent()) {
        return lobby.snapshot();
      }
      checkJoinable(lobby);
      lobby.participants().add(participant);
      log.info("{} joined lobby {} ({}/{})", participant.displayName(), lobbyId,
          lobby.participants().size(), lobby.maxParticipants());
      return lobby.snapshot();
    } finally {
      lobby.lock().unlock();
    }
  }

  /**
   * Add a simulated racer. Bots are ready as soon as they join.
   *
   * @throws NoSuchElementException if the lobby does not exist
   * @throws IllegalStateException if the lobby is not waiting or is full
   */
  public BotAdded addBot(String lobbyId, BotDifficulty difficulty) {
    BotDifficulty d = difficulty == null ? BotDifficulty.MEDIUM : difficulty;
    Lobby lobby = require(lobbyId);
    lobby.lock().lock();
    try {
      checkJoinable(lobby);
      String id = "bot-" + UUID.randomUUID().toString().substring(0, 8);
      String name = BOT_NAMES.get(random.nextInt(BOT_NAMES.size())) + " (" + d.label() + ")";
      EquipmentType[] kinds = EquipmentType.values();
      EquipmentType equipment = kinds[random.nextInt(kinds.length)];

      LobbyParticipant bot = LobbyParticipant.bot(id, name, equipment, d, clock.instant());
      lobby.participants().add(bot);
      log.info("Bot {} added to lobby {}", name, lobbyId);
      return new BotAdded(lobby.snapshot(), bot.snapshot());
    } finally {
      lobby.lock().unlock();
    }
  }

  /**
   * Mark a participant ready.
   *
   * @return empty if the lobby does not exist; an unknown participant leaves the lobby unchanged
   */
  public Optional<LobbySnapshot> setReady(String lobbyId, String participantId) {
    Lobby lobby = lobbyId == null ? null : lobbies.get(lobbyId);
    if (lobby == null) return Optional.empty();
    lobby.lock().lock();
    try {
      if (lobby.status() == LobbyStatus.WAITING) {
        lobby.participant(participantId)
            .ifPresent(p -> p.status(ParticipantStatus.READY));
      }
      return Optional.of(lobby.snapshot());
    } finally {
      lobby.lock().unlock();
    }
  }

  /**
   * Take a participant off the roster.
   *
   * @return empty if the lobby does not exist; an absent participant leaves the lobby unchanged
   * @throws IllegalStateException if the lobby is no longer waiting
   */
  public Optional<LobbySnapshot> removeParticipant(String lobbyId, String participantId) {
    Lobby lobby = lobbyId == null ? null : lobbies.get(lobbyId);
    if (lobby == null) return Optional.empty();
    lobby.lock().lock();
    try {
      if (lobby.participant(participantId).isEmpty()) {
        return Optional.of(lobby.snapshot());
      }
      if (lobby.status() != LobbyStatus.WAITING) {
        throw new IllegalStateException("Lobby roster is closed");
      }
      lobby.participants().removeIf(p -> p.id().equals(participantId));
      log.info("{} left lobby {}", participantId, lobbyId);
      return Optional.of(lobby.snapshot());
    } finally {
      lobby.lock().unlock();
    }
  }

  /** Caller holds the lobby lock. */
  public boolean canStart(Lobby lobby) {
    return lobby.status() == LobbyStatus.WAITING
        && lobby.participants().size() >= lobby.minParticipants()
        && lobby.participants().stream().allMatch(LobbyParticipant::readyOrBot);
  }

  /**
   * Lobbies a client should see in its lobby list: waiting or completed ones, oldest first.
   *
   * @param userId null for the unfiltered listing; otherwise only lobbies the user created or is
   *     on the roster of
   */
  public List<LobbySnapshot> listVisible(String userId) {
    return lobbies.values().stream()
        .map(l -> withLock(l, l::snapshot))
        .filter(l -> l.status() == LobbyStatus.WAITING || l.status() == LobbyStatus.COMPLETED)
        .filter(l -> userId == null || l.involves(userId))
        .sorted(Comparator.comparing(LobbySnapshot::createdAt))
        .toList();
  }

  public Optional<LobbySnapshot> find(String lobbyId) {
    Lobby lobby = lobbyId == null ? null : lobbies.get(lobbyId);
    return lobby == null ? Optional.empty() : Optional.of(withLock(lobby, lobby::snapshot));
  }

  /**
   * Cancel a lobby that has not completed. Only its creator may do so.
   *
   * @throws NoSuchElementException if the lobby does not exist
   * @throws IllegalStateException if the requester is not the creator or the lobby already ended
   */
  public LobbySnapshot cancel(String lobbyId, String requesterId) {
    Lobby lobby = require(lobbyId);
    lobby.lock().lock();
    try {
      if (!lobby.creatorId().equals(requesterId)) {
        throw new IllegalStateException("Only the creator can cancel the lobby");
      }
      if (lobby.status() == LobbyStatus.COMPLETED || lobby.status() == LobbyStatus.CANCELLED) {
        throw new IllegalStateException("Lobby already ended");
      }
      lobby.status(LobbyStatus.CANCELLED);
      log.info("Lobby {} cancelled", lobbyId);
      return lobby.snapshot();
    } finally {
      lobby.lock().unlock();
    }
  }

  /** Flip a roster entry to finished while its race runs. */
  public void markFinished(String lobbyId, String participantId) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) return;
    lobby.lock().lock();
    try {
      if (lobby.status() == LobbyStatus.IN_PROGRESS) {
        lobby.participant(participantId).ifPresent(p -> p.status(ParticipantStatus.FINISHED));
      }
    } finally {
      lobby.lock().unlock();
    }
  }

  /**
   * Record the results of the lobby's race and close the lobby.
   *
   * @return the completed lobby, or empty if it no longer exists or was cancelled meanwhile
   */
  public Optional<LobbySnapshot> complete(
      String lobbyId, String raceId, List<RaceParticipantSnapshot> results) {
    Lobby lobby = lobbies.get(lobbyId);
    if (lobby == null) return Optional.empty();
    lobby.lock().lock();
    try {
      if (lobby.status() == LobbyStatus.CANCELLED) {
        return Optional.empty();
      }
      lobby.status(LobbyStatus.COMPLETED);
      lobby.raceId(raceId);
      lobby.raceResults(results);
      return Optional.of(lobby.snapshot());
    } finally {
      lobby.lock().unlock();
    }
  }

  /**
   * Live lobby for the race engine, which locks it itself.
   *
   * @throws NoSuchElementException if the lobby does not exist
   */
  public Lobby require(String lobbyId) {
    Lobby lobby = lobbyId == null ? null : lobbies.get(lobbyId);
    if (lobby == null) throw new NoSuchElementException("Lobby not found");
    return lobby;
  }

  public int size() {
    return lobbies.size();
  }

  // Helpers

  private void checkJoinable(Lobby lobby) {
    if (lobby.status() != LobbyStatus.WAITING) {
      throw new IllegalStateException("Lobby is not open for joining");
    }
    if (lobby.full()) {
      throw new IllegalStateException("Lobby full");
    }
  }

  private static <T> T withLock(Lobby lobby, Supplier<T> action) {
    lobby.lock().lock();
    try {
      return action.get();
    } finally {
      lobby.lock().unlock();
    }
  }
}
