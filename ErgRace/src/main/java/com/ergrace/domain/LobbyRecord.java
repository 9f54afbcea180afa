package com.ergrace.domain;

import java.time.Instant;

/** Persisted terms of a lobby, without its roster. Used to recover waiting lobbies. */
public record LobbyRecord(
    String id,
    String creatorId,
    int raceDistance,
    String entryFee,
    PayoutMode payoutMode,
    LobbyStatus status,
    int maxParticipants,
    int minParticipants,
    Instant createdAt) {}
