package com.ergrace.dto;

import com.ergrace.domain.LobbySnapshot;
import com.ergrace.domain.RaceSnapshot;

public record RejoinMessage(String type, LobbySnapshot lobby, RaceSnapshot race) {
  public RejoinMessage(LobbySnapshot lobby, RaceSnapshot race) {
    this("rejoined", lobby, race);
  }
}
