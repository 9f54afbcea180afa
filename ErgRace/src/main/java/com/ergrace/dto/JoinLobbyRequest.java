package com.ergrace.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record JoinLobbyRequest(@NotBlank String lobbyId, @Valid @NotNull ParticipantRequest participant) {}
