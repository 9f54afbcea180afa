package com.ergrace.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/** REST body of a race update; the race comes from the path. */
public record ParticipantMetricsRequest(
    @NotBlank String participantId,
    @PositiveOrZero double distance,
    @PositiveOrZero @DecimalMax(value = "600", inclusive = false) double pace,
    @PositiveOrZero @DecimalMax(value = "2000", inclusive = false) double watts) {}
