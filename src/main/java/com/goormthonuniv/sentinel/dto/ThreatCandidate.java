package com.goormthonuniv.sentinel.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ThreatCandidate(
        @NotBlank String name,
        String description,
        String keywords,          // "viral, video, leak"
        @NotNull @Min(0) @Max(100) Integer severity,
        String location
) {}
