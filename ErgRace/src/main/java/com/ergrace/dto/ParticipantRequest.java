package com.ergrace.dto;

import com.ergrace.domain.EquipmentType;
import jakarta.validation.constraints.NotBlank;

public record ParticipantRequest(
    @NotBlank String id,
    @NotBlank String displayName,
    String walletAddress,
    EquipmentType equipmentType) {}
