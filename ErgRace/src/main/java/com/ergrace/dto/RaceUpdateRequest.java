package com.ergrace.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RaceUpdateRequest(
    @NotBlank String raceId, @NotBlank String participantId, @Valid @NotNull Metrics metrics) {}
