package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.enums.CrisisVerdict;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** 위기 단위 타임라인 종합 */
public record CrisisConclusion(
        @NotNull CrisisVerdict verdictStatus,
        @NotBlank String verdictSummary
) {}
