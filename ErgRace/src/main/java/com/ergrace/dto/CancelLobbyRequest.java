package com.ergrace.dto;

import jakarta.validation.constraints.NotBlank;

public record CancelLobbyRequest(@NotBlank String lobbyId, @NotBlank String requesterId) {}
