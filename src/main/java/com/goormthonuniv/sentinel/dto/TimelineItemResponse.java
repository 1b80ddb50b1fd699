package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.entity.SourceRef;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.VerificationStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TimelineItemResponse(
        UUID id,
        UUID crisisId,
        String claimText,
        String summary,
        VerificationStatus status,
        String location,
        List<SourceRef> sources,
        int confidenceScore,
        String reasoningTrace,
        Instant timestamp
) {
    public static TimelineItemResponse from(TimelineItem t) {
        return new TimelineItemResponse(t.getId(), t.getCrisisId(), t.getClaimText(), t.getSummary(), t.getStatus(),
                t.getLocation(), t.getSources() == null ? List.of() : List.copyOf(t.getSources()),
                t.getConfidenceScore(), t.getReasoningTrace(), t.getTimestamp());
    }
}
