package com.ergrace.dto;

import com.ergrace.domain.LobbySnapshot;
import java.util.List;

public record LobbyListMessage(String type, List<LobbySnapshot> lobbies) {
  public LobbyListMessage(List<LobbySnapshot> lobbies) {
    this("lobby_list", lobbies);
  }
}
