package com.ergrace.dto;

import com.ergrace.domain.RaceSnapshot;

/** {@code race_started}, {@code race_update} or {@code race_completed}. */
public record RaceMessage(String type, RaceSnapshot race) {}
