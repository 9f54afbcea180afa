package com.ergrace.dto;

import jakarta.validation.constraints.NotBlank;

public record IdentifyRequest(@NotBlank String userId) {}
