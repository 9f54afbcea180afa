package com.ergrace.dto;

import jakarta.validation.constraints.NotBlank;

public record ParticipantIdRequest(@NotBlank String participantId) {}
