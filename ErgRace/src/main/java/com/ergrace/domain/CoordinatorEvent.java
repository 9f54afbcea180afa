package com.ergrace.domain;

import java.util.List;

/** State-change notification produced by the core; transports decide how to deliver it. */
public interface CoordinatorEvent {

  /** Wire name of the event. */
  String type();

  record LobbyCreated(LobbySnapshot lobby) implements CoordinatorEvent {
    @Override
    public String type() {
      return "lobby_created";
    }
  }

  record LobbyUpdated(LobbySnapshot lobby) implements CoordinatorEvent {
    @Override
    public String type() {
      return "lobby_updated";
    }
  }

  record LobbyList(List<LobbySnapshot> lobbies) implements CoordinatorEvent {
    @Override
    public String type() {
      return "lobby_list";
    }
  }

  record Countdown(String lobbyId, String raceId, int value) implements CoordinatorEvent {
    @Override
    public String type() {
      return "countdown";
    }
  }

  record RaceStarted(RaceSnapshot race) implements CoordinatorEvent {
    @Override
    public String type() {
      return "race_started";
    }
  }

  record RaceUpdate(RaceSnapshot race) implements CoordinatorEvent {
    @Override
    public String type() {
      return "race_update";
    }
  }

  record RaceCompleted(RaceSnapshot race) implements CoordinatorEvent {
    @Override
    public String type() {
      return "race_completed";
    }
  }
}
