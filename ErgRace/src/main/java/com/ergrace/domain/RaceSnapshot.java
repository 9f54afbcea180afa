package com.ergrace.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record RaceSnapshot(
    String id,
    String lobbyId,
    RaceStatus status,
    Instant startTime,
    int targetDistance,
    List<RaceParticipantSnapshot> participants,
    int finishedCount) {

  public Optional<RaceParticipantSnapshot> participant(String participantId) {
    return participants.stream().filter(p -> p.id().equals(participantId)).findFirst();
  }
}
