package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RaceParticipantSnapshot(
    String id,
    String displayName,
    String walletAddress,
    EquipmentType equipmentType,
    @JsonProperty("isBot") boolean bot,
    BotDifficulty botDifficulty,
    double distance,
    double pace,
    double watts,
    @JsonProperty("isFinished") boolean finished,
    Long finishTime,
    Integer position) {}
