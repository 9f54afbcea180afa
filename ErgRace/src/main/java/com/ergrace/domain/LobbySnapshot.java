package com.ergrace.domain;

import java.time.Instant;
import java.util.List;

/** Immutable view of a lobby, taken under the lobby lock. */
public record LobbySnapshot(
    String id,
    String creatorId,
    int raceDistance,
    String entryFee,
    PayoutMode payoutMode,
    LobbyStatus status,
    int maxParticipants,
    int minParticipants,
    Instant createdAt,
    List<LobbyParticipantSnapshot> participants,
    int participantCount,
    String raceId,
    List<RaceParticipantSnapshot> raceResults) {

  public boolean involves(String userId) {
    return creatorId.equals(userId) || participants.stream().anyMatch(p -> p.id().equals(userId));
  }
}
