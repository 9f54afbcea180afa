package com.ergrace.dto;

import jakarta.validation.constraints.NotBlank;

/** Ready-up or leave: the lobby and the roster entry it applies to. */
public record ParticipantActionRequest(@NotBlank String lobbyId, @NotBlank String participantId) {}
