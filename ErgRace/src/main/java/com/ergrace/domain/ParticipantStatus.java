package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParticipantStatus {
  @JsonProperty("deposited")
  DEPOSITED,
  @JsonProperty("ready")
  READY,
  @JsonProperty("racing")
  RACING,
  @JsonProperty("finished")
  FINISHED,
  @JsonProperty("disconnected")
  DISCONNECTED
}
