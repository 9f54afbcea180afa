package com.ergrace.dto;

import com.ergrace.domain.BotDifficulty;
import jakarta.validation.constraints.NotBlank;

public record AddBotRequest(@NotBlank String lobbyId, BotDifficulty difficulty) {}
