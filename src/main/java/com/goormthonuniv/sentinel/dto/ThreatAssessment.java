package com.goormthonuniv.sentinel.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/** 탐지 단계 판정 응답 */
public record ThreatAssessment(
        @NotNull List<@Valid @NotNull ThreatCandidate> threats
) {}
