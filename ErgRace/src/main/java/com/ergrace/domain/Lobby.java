package com.ergrace.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A waiting room for one race.
 *
 * <p>Not thread-safe on its own: callers hold {@link #lock()} for every read-modify-write and
 * for {@link #snapshot()}.
 */
public class Lobby {
  private final String id;
  private final String creatorId;
  private final int raceDistance;
  private final String entryFee;
  private final PayoutMode payoutMode;
  private final int maxParticipants;
  private final int minParticipants;
  private final Instant createdAt;
  private final List<LobbyParticipant> participants = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();

  private LobbyStatus status = LobbyStatus.WAITING;
  private String raceId;
  private List<RaceParticipantSnapshot> raceResults;

  public Lobby(
      String id,
      String creatorId,
      int raceDistance,
      String entryFee,
      PayoutMode payoutMode,
      int maxParticipants,
      int minParticipants,
      Instant createdAt) {
    this.id = id;
    this.creatorId = creatorId;
    this.raceDistance = raceDistance;
    this.entryFee = entryFee;
    this.payoutMode = payoutMode;
    this.maxParticipants = maxParticipants;
    this.minParticipants = minParticipants;
    this.createdAt = createdAt;
  }

  public String id() {
    return id;
  }

  public String creatorId() {
    return creatorId;
  }

  public int raceDistance() {
    return raceDistance;
  }

  public String entryFee() {
    return entryFee;
  }

  public PayoutMode payoutMode() {
    return payoutMode;
  }

  public int maxParticipants() {
    return maxParticipants;
  }

  public int minParticipants() {
    return minParticipants;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public List<LobbyParticipant> participants() {
    return participants;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public LobbyStatus status() {
    return status;
  }

  public void status(LobbyStatus s) {
    status = s;
  }

  public String raceId() {
    return raceId;
  }

  public void raceId(String r) {
    raceId = r;
  }

  public void raceResults(List<RaceParticipantSnapshot> results) {
    raceResults = List.copyOf(results);
  }

  public boolean full() {
    return participants.size() >= maxParticipants;
  }

  public Optional<LobbyParticipant> participant(String participantId) {
    return participants.stream().filter(p -> p.id().equals(participantId)).findFirst();
  }

  public LobbySnapshot snapshot() {
    List<LobbyParticipantSnapshot> roster =
        participants.stream().map(LobbyParticipant::snapshot).toList();
    return new LobbySnapshot(
        id,
        creatorId,
        raceDistance,
        entryFee,
        payoutMode,
        status,
        maxParticipants,
        minParticipants,
        createdAt,
        roster,
        roster.size(),
        raceId,
        raceResults);
  }
}
