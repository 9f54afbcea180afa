package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LobbyStatus {
  @JsonProperty("waiting")
  WAITING,
  @JsonProperty("starting")
  STARTING,
  @JsonProperty("in_progress")
  IN_PROGRESS,
  @JsonProperty("completed")
  COMPLETED,
  @JsonProperty("cancelled")
  CANCELLED
}
