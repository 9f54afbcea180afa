package com.ergrace.dto;

public record CountdownMessage(String type, String lobbyId, String raceId, int value) {
  public CountdownMessage(String lobbyId, String raceId, int value) {
    this("countdown", lobbyId, raceId, value);
  }
}
