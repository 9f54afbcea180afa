package com.ergrace.application;

import com.ergrace.domain.CoordinatorEvent.Countdown;
import com.ergrace.domain.CoordinatorEvent.LobbyUpdated;
import com.ergrace.domain.CoordinatorEvent.RaceCompleted;
import com.ergrace.domain.CoordinatorEvent.RaceStarted;
import com.ergrace.domain.CoordinatorEvent.RaceUpdate;
import com.ergrace.domain.Lobby;
import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.LobbyStatus;
import com.ergrace.domain.ParticipantStatus;
import com.ergrace.domain.Race;
import com.ergrace.domain.RaceParticipant;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.RaceStatus;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Race lifecycle: spawn from a ready lobby, count down, run the tick loop, record finishes and
 * complete exactly once.
 *
 * <p>Each race is guarded by its own lock. Race events are enqueued on the broadcaster while the
 * lock is held, which only hands them to the dispatch executor, so subscribers see a race's
 * events in the order they happened. Roster side effects on the lobby (finished participants,
 * completion) are applied after the race lock is released; the two locks are never held together.
 *
 * <p>Finish order is the order in which crossings are observed, whether by a client update or by
 * a tick, not the order in which they happened on the water.
 */
@Service
public class RaceEngine {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Map<String, Race> races = new ConcurrentHashMap<>();

  private final LobbyRegistry lobbies;
  private final BotSimulator bots;
  private final EventBroadcaster events;
  private final RecordSync records;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final long countdownIntervalMs;
  private final long tickIntervalMs;

  public RaceEngine(
      LobbyRegistry lobbies,
      BotSimulator bots,
      EventBroadcaster events,
      RecordSync records,
      @Qualifier("raceScheduler") ScheduledExecutorService scheduler,
      Clock clock,
      @Value("${ergrace.race.countdown-interval-ms:1000}") long countdownIntervalMs,
      @Value("${ergrace.race.tick-interval-ms:500}") long tickIntervalMs) {
    this.lobbies = lobbies;
    this.bots = bots;
    this.events = events;
    this.records = records;
    this.scheduler = scheduler;
    this.clock = clock;
    this.countdownIntervalMs = countdownIntervalMs;
    this.tickIntervalMs = tickIntervalMs;
  }

  /**
   * Spawn a race from a lobby and start its countdown.
   *
   * <p>Readiness is checked and the lobby flipped to in-progress under the lobby lock, so two
   * concurrent starts cannot both spawn a race.
   *
   * @param lobbyId lobby to race
   * @return the pending race
   * @throws NoSuchElementException if the lobby does not exist
   * @throws IllegalStateException if the lobby cannot start
   */
  public RaceSnapshot start(String lobbyId) {
    Lobby lobby = lobbies.require(lobbyId);

    Race race;
    LobbySnapshot lobbySnap;
    lobby.lock().lock();
    try {
      if (!lobbies.canStart(lobby)) {
        throw new IllegalStateException(notStartableReason(lobby));
      }
      List<RaceParticipant> field =
          lobby.participants().stream().map(RaceParticipant::new).toList();
      race = new Race(UUID.randomUUID().toString(), lobby.id(), lobby.raceDistance(), field);
      races.put(race.id(), race);

      lobby.status(LobbyStatus.IN_PROGRESS);
      lobby.raceId(race.id());
      lobby.participants().forEach(p -> p.status(ParticipantStatus.RACING));
      lobbySnap = lobby.snapshot();
    } finally {
      lobby.lock().unlock();
    }
    events.toRoom(lobbyId, new LobbyUpdated(lobbySnap));

    race.lock().lock();
    try {
      // an abort may have landed between the lobby flip and here
      if (race.status() == RaceStatus.PENDING) {
        race.timer(
            scheduler.scheduleAtFixedRate(
                () -> countdownStep(race), 0, countdownIntervalMs, TimeUnit.MILLISECONDS));
        log.info("Race {} spawned for lobby {} with {} racers",
            race.id(), lobbyId, race.participants().size());
      }
      return race.snapshot();
    } finally {
      race.lock().unlock();
    }
  }

  /**
   * Apply a client-reported sample.
   *
   * <p>A participant who already finished is left untouched and nothing is broadcast. Distance
   * never moves backwards, whatever the client reports.
   *
   * @throws NoSuchElementException if the race or the participant is unknown
   * @throws IllegalStateException if the race is still counting down or was aborted
   */
  public RaceSnapshot recordMetrics(
      String raceId, String participantId, double distance, double pace, double watts) {
    Race race = require(raceId);

    String finishedId = null;
    boolean completed;
    RaceSnapshot snap;
    race.lock().lock();
    try {
      RaceParticipant p =
          race.participant(participantId)
              .orElseThrow(() -> new NoSuchElementException("Participant not in race"));
      if (p.finished()) {
        return race.snapshot();
      }
      if (race.status() != RaceStatus.RACING) {
        throw new IllegalStateException(
            race.status() == RaceStatus.PENDING ? "Race has not started" : "Race is over");
      }

      p.distance(distance);
      p.pace(pace);
      p.watts(watts);
      if (p.distance() >= race.targetDistance() && race.finish(p, clock.instant())) {
        finishedId = p.id();
        log.info("Race {}: {} finished in position {}", raceId, p.displayName(), p.position());
      }
      completed = completeIfDone(race);
      snap = race.snapshot();
      events.toRoom(race.lobbyId(), new RaceUpdate(snap));
    } finally {
      race.lock().unlock();
    }

    if (finishedId != null) {
      lobbies.markFinished(race.lobbyId(), finishedId);
    }
    if (completed) {
      afterCompletion(snap);
    }
    return snap;
  }

  /**
   * One step of the race clock: advance every unfinished bot, publish the race, and complete it
   * if everyone is home. Does nothing unless the race is racing.
   */
  public void tick(String raceId) {
    Race race = races.get(raceId);
    if (race == null) return;

    List<String> finished = new ArrayList<>();
    boolean completed;
    RaceSnapshot snap;
    race.lock().lock();
    try {
      if (race.status() != RaceStatus.RACING) {
        return;
      }
      Instant now = clock.instant();
      double elapsedSeconds = Duration.between(race.startTime(), now).toMillis() / 1000.0;
      for (RaceParticipant p : race.participants()) {
        if (!p.bot() || p.finished()) continue;
        bots.advance(p, race.targetDistance(), elapsedSeconds);
        if (p.distance() >= race.targetDistance() && race.finish(p, now)) {
          finished.add(p.id());
          log.info("Race {}: bot {} finished in position {}", raceId, p.displayName(), p.position());
        }
      }
      completed = completeIfDone(race);
      snap = race.snapshot();
      events.toRoom(race.lobbyId(), new RaceUpdate(snap));
    } finally {
      race.lock().unlock();
    }

    finished.forEach(id -> lobbies.markFinished(race.lobbyId(), id));
    if (completed) {
      afterCompletion(snap);
    }
  }

  /**
   * Tear down a race that has not completed: cancel its timer and mark it aborted. A countdown
   * in flight never reaches its start.
   *
   * @return the race as it stands, or empty if unknown
   */
  public Optional<RaceSnapshot> abort(String raceId) {
    Race race = raceId == null ? null : races.get(raceId);
    if (race == null) return Optional.empty();
    race.lock().lock();
    try {
      if (race.status().live()) {
        race.status(RaceStatus.ABORTED);
        race.cancelTimer();
        events.toRoom(race.lobbyId(), new RaceUpdate(race.snapshot()));
        log.info("Race {} aborted", raceId);
      }
      return Optional.of(race.snapshot());
    } finally {
      race.lock().unlock();
    }
  }

  public Optional<RaceSnapshot> find(String raceId) {
    Race race = raceId == null ? null : races.get(raceId);
    if (race == null) return Optional.empty();
    race.lock().lock();
    try {
      return Optional.of(race.snapshot());
    } finally {
      race.lock().unlock();
    }
  }

  /** The race spawned from a lobby, if any. */
  public Optional<RaceSnapshot> raceFor(String lobbyId) {
    return lobbies.find(lobbyId).map(LobbySnapshot::raceId).flatMap(this::find);
  }

  public int size() {
    return races.size();
  }

  @PreDestroy
  public void shutdown() {
    races.values().forEach(r -> {
      r.lock().lock();
      try {
        r.cancelTimer();
      } finally {
        r.lock().unlock();
      }
    });
  }

  // Helpers

  /** Countdown firing: 5..1, then the start. Runs on the race scheduler. */
  private void countdownStep(Race race) {
    race.lock().lock();
    try {
      if (race.status() != RaceStatus.PENDING) {
        return;
      }
      if (race.countdown() > 0) {
        events.toRoom(race.lobbyId(), new Countdown(race.lobbyId(), race.id(), race.nextCountdown()));
        return;
      }
      race.startTime(clock.instant());
      race.status(RaceStatus.RACING);
      race.timer(
          scheduler.scheduleAtFixedRate(
              () -> tick(race.id()), tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS));
      events.toRoom(race.lobbyId(), new RaceStarted(race.snapshot()));
      log.info("Race {} started", race.id());
    } finally {
      race.lock().unlock();
    }
  }

  /** Caller holds the race lock. */
  private boolean completeIfDone(Race race) {
    if (!race.allFinished() || !race.claimCompletion()) {
      return false;
    }
    race.status(RaceStatus.COMPLETED);
    race.cancelTimer();
    return true;
  }

  private void afterCompletion(RaceSnapshot race) {
    LobbySnapshot lobby =
        lobbies.complete(race.lobbyId(), race.id(), race.participants()).orElse(null);
    events.toRoom(race.lobbyId(), new RaceCompleted(race));
    events.refreshLobbyLists();
    records.raceCompleted(lobby, race);
    log.info("Race {} completed ({} finishers)", race.id(), race.finishedCount());
  }

  private Race require(String raceId) {
    Race race = raceId == null ? null : races.get(raceId);
    if (race == null) throw new NoSuchElementException("Race not found");
    return race;
  }

  private static String notStartableReason(Lobby lobby) {
    if (lobby.status() != LobbyStatus.WAITING) {
      return "Lobby is not waiting to start";
    }
    if (lobby.participants().size() < lobby.minParticipants()) {
      return "Need at least " + lobby.minParticipants() + " participants to start";
    }
    return "Not all participants are ready";
  }
}
