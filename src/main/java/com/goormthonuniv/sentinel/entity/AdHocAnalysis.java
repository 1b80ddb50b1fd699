package com.goormthonuniv.sentinel.entity;

import com.goormthonuniv.sentinel.enums.AnalysisStatus;
import com.goormthonuniv.sentinel.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 사용자가 직접 제출한 주장 검증 요청. 실패 시 FAILED로 남으며 PENDING에 머물지 않는다.
 */
@Entity
@Table(name = "adhoc_analyses")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdHocAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "query_text", nullable = false, length = 2000)
    private String queryText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AnalysisStatus status = AnalysisStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict_status", length = 20)
    private VerificationStatus verdictStatus;

    @Column(name = "verdict_summary", length = 4000)
    private String verdictSummary;

    @Convert(converter = SourceRefListConverter.class)
    @Column(name = "verdict_sources", length = 8000)
    @Builder.Default
    private List<SourceRef> verdictSources = new ArrayList<>();

    @Column(name = "confidence_score", nullable = false)
    private int confidenceScore;

    @Column(name = "reasoning_trace", length = 8000)
    private String reasoningTrace;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
