package com.ergrace.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * One telemetry sample. Bounds are sanity limits of the equipment: pace under ten minutes per
 * 500m, power under 2000 W.
 */
public record Metrics(
    @PositiveOrZero double distance,
    @PositiveOrZero @DecimalMax(value = "600", inclusive = false) double pace,
    @PositiveOrZero @DecimalMax(value = "2000", inclusive = false) double watts) {}
