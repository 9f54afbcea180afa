package com.ergrace.dto;

import jakarta.validation.constraints.NotBlank;

/** Commands that only name a lobby: rejoin, start. */
public record LobbyRequest(@NotBlank String lobbyId) {}
