package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PayoutMode {
  @JsonProperty("winner_takes_all")
  WINNER_TAKES_ALL,
  @JsonProperty("top_three")
  TOP_THREE
}
