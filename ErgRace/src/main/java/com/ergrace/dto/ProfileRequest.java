package com.ergrace.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record ProfileRequest(
    @Size(max = 64) String displayName, @Email String email, @Size(max = 128) String walletAddress) {}
