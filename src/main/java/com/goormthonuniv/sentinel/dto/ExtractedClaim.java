package com.goormthonuniv.sentinel.dto;

import jakarta.validation.constraints.NotBlank;

public record ExtractedClaim(
        @NotBlank String text,
        String location
) {}
