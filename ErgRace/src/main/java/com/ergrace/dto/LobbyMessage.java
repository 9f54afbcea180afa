package com.ergrace.dto;

import com.ergrace.domain.LobbySnapshot;

/** {@code lobby_created} or {@code lobby_updated}. */
public record LobbyMessage(String type, LobbySnapshot lobby) {}
