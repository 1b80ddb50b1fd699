package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.entity.AdHocAnalysis;
import com.goormthonuniv.sentinel.entity.SourceRef;
import com.goormthonuniv.sentinel.enums.AnalysisStatus;
import com.goormthonuniv.sentinel.enums.VerificationStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AnalysisResponse(
        UUID id,
        String queryText,
        AnalysisStatus status,
        VerificationStatus verdictStatus,     // 완료 전에는 null
        String verdictSummary,
        List<SourceRef> verdictSources,
        int confidenceScore,
        String reasoningTrace,
        Instant createdAt
) {
    public static AnalysisResponse from(AdHocAnalysis a) {
        return new AnalysisResponse(a.getId(), a.getQueryText(), a.getStatus(), a.getVerdictStatus(),
                a.getVerdictSummary(), a.getVerdictSources() == null ? List.of() : List.copyOf(a.getVerdictSources()),
                a.getConfidenceScore(), a.getReasoningTrace(), a.getCreatedAt());
    }
}
