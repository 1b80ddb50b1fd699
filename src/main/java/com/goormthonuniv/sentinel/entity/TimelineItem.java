package com.goormthonuniv.sentinel.entity;

import com.goormthonuniv.sentinel.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 위기 타임라인의 주장 1건. (crisis_id, claim_text)가 자연키다.
 */
@Entity
@Table(name = "timeline_items", indexes = {
        @Index(name = "idx_timeline_crisis", columnList = "crisis_id"),
        @Index(name = "idx_timeline_claim", columnList = "crisis_id, claim_text")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /** null이면 사용자 제보(ad-hoc) 범위 */
    @Column(name = "crisis_id")
    private UUID crisisId;

    @Column(name = "claim_text", nullable = false, length = 2000)
    private String claimText;

    @Column(length = 4000)
    private String summary;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VerificationStatus status;

    @Column(length = 200)
    private String location;

    @Convert(converter = SourceRefListConverter.class)
    @Column(length = 8000)
    @Builder.Default
    private List<SourceRef> sources = new ArrayList<>();

    @Column(name = "confidence_score", nullable = false)
    private int confidenceScore;

    @Column(name = "reasoning_trace", length = 8000)
    private String reasoningTrace;

    @Column(nullable = false)
    private Instant timestamp;
}
