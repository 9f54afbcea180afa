package com.ergrace.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The live session spawned from a lobby.
 *
 * <p>Guarded by {@link #lock()}, like {@link Lobby}. The race owns at most one scheduled task at
 * a time (its countdown, then its tick loop); replacing or cancelling it happens under the lock.
 */
public class Race {
  public static final int COUNTDOWN_FROM = 5;

  private final String id;
  private final String lobbyId;
  private final int targetDistance;
  private final List<RaceParticipant> participants;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicBoolean completion = new AtomicBoolean();

  private RaceStatus status = RaceStatus.PENDING;
  private Instant startTime;
  private int finishedCount;
  private int countdown = COUNTDOWN_FROM;
  private ScheduledFuture<?> timer;

  public Race(String id, String lobbyId, int targetDistance, List<RaceParticipant> participants) {
    this.id = id;
    this.lobbyId = lobbyId;
    this.targetDistance = targetDistance;
    this.participants = List.copyOf(participants);
  }

  public String id() {
    return id;
  }

  public String lobbyId() {
    return lobbyId;
  }

  public int targetDistance() {
    return targetDistance;
  }

  public List<RaceParticipant> participants() {
    return participants;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public RaceStatus status() {
    return status;
  }

  public void status(RaceStatus s) {
    status = s;
  }

  public Instant startTime() {
    return startTime;
  }

  public void startTime(Instant t) {
    startTime = t;
  }

  public int finishedCount() {
    return finishedCount;
  }

  /** Next countdown value to announce, 0 once the countdown has run out. */
  public int countdown() {
    return countdown;
  }

  public int nextCountdown() {
    return countdown--;
  }

  public Optional<RaceParticipant> participant(String participantId) {
    return participants.stream().filter(p -> p.id().equals(participantId)).findFirst();
  }

  /**
   * Mark a participant finished and give it the next position.
   *
   * @return false if the participant had already finished
   */
  public boolean finish(RaceParticipant p, Instant now) {
    if (p.finished()) {
      return false;
    }
    long elapsed = now.toEpochMilli() - startTime.toEpochMilli();
    finishedCount++;
    p.finish(targetDistance, elapsed, finishedCount);
    return true;
  }

  public boolean allFinished() {
    return participants.stream().allMatch(RaceParticipant::finished);
  }

  /** Claim the single completion of this race. */
  public boolean claimCompletion() {
    return completion.compareAndSet(false, true);
  }

  public void timer(ScheduledFuture<?> t) {
    cancelTimer();
    timer = t;
  }

  public void cancelTimer() {
    if (timer != null) {
      timer.cancel(false);
      timer = null;
    }
  }

  public RaceSnapshot snapshot() {
    return new RaceSnapshot(
        id,
        lobbyId,
        status,
        startTime,
        targetDistance,
        participants.stream().map(RaceParticipant::snapshot).toList(),
        finishedCount);
  }
}
