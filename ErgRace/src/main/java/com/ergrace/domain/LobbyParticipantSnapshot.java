package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record LobbyParticipantSnapshot(
    String id,
    String displayName,
    String walletAddress,
    EquipmentType equipmentType,
    ParticipantStatus status,
    @JsonProperty("isBot") boolean bot,
    BotDifficulty botDifficulty,
    Instant joinedAt) {}
