package com.ergrace.dto;

import com.ergrace.domain.BotDifficulty;

/** REST body of add-bot; a missing difficulty means medium. */
public record BotRequest(BotDifficulty difficulty) {}
