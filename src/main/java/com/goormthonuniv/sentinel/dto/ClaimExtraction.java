package com.goormthonuniv.sentinel.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ClaimExtraction(
        @NotNull List<@Valid @NotNull ExtractedClaim> claims
) {}
