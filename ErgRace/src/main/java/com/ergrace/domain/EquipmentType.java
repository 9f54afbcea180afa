package com.ergrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EquipmentType {
  @JsonProperty("rower")
  ROWER,
  @JsonProperty("bike")
  BIKE,
  @JsonProperty("ski")
  SKI
}
