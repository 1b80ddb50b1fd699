package com.goormthonuniv.sentinel.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeRequest(
        @NotBlank @Size(min = 5, max = 2000) String queryText   // 제보 원문 또는 의심 주장
) {}
