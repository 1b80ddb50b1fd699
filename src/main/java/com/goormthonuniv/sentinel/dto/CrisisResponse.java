package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.enums.CrisisVerdict;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CrisisResponse(
        UUID id,
        String name,
        String description,
        List<String> keywords,
        int severity,
        String location,
        CrisisVerdict verdictStatus,
        String verdictSummary,
        Instant createdAt,
        Instant updatedAt
) {
    public static CrisisResponse from(Crisis c) {
        return new CrisisResponse(c.getId(), c.getName(), c.getDescription(), c.keywordList(), c.getSeverity(),
                c.getLocation(), c.getVerdictStatus(), c.getVerdictSummary(), c.getCreatedAt(), c.getUpdatedAt());
    }
}
