package com.ergrace.domain;

import java.time.Instant;

/** Racer profile as kept by the external record store. */
public record UserProfile(
    String id,
    String displayName,
    String email,
    String walletAddress,
    int skillRating,
    int totalRaces,
    int totalWins,
    String totalEarnings,
    Instant createdAt,
    Instant lastActive) {

  public static final int DEFAULT_SKILL_RATING = 1500;
}
