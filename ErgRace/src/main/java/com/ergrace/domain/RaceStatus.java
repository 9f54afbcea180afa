package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RaceStatus {
  /** Spawned, countdown running. */
  @JsonProperty("pending")
  PENDING,
  @JsonProperty("racing")
  RACING,
  @JsonProperty("completed")
  COMPLETED,
  /** Torn down before completion; timers cancelled. */
  @JsonProperty("aborted")
  ABORTED;

  public boolean live() {
    return this == PENDING || this == RACING;
  }
}
