package com.ergrace.dto;

import com.ergrace.domain.PayoutMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

public record CreateLobbyRequest(
    @NotBlank String creatorId,
    @Positive int raceDistance,
    @Pattern(regexp = "\\d+(\\.\\d+)?") String entryFee,
    PayoutMode payoutMode,
    @Min(2) @Max(100) Integer maxParticipants,
    @Min(2) @Max(100) Integer minParticipants) {}
