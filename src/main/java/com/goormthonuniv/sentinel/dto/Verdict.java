package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.entity.SourceRef;
import com.goormthonuniv.sentinel.enums.VerificationStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/** 주장 1건에 대한 종합 판정 */
public record Verdict(
        @NotNull VerificationStatus status,
        @NotBlank String summary,
        @NotNull @Min(0) @Max(100) Integer confidence,
        String reasoning,
        List<SourceRef> sources
) {
    public Verdict {
        sources = sources == null ? List.of() : List.copyOf(sources);
        reasoning = reasoning == null ? "" : reasoning;
    }
}
