package com.goormthonuniv.sentinel.entity;

import com.goormthonuniv.sentinel.enums.CrisisVerdict;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "crises", indexes = {
        @Index(name = "idx_crisis_severity", columnList = "severity"),
        @Index(name = "idx_crisis_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Crisis {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 300)
    private String name;

    @Column(length = 4000)
    private String description;

    /** 쉼표 구분 키워드 */
    @Column(nullable = false, length = 1000)
    private String keywords;

    @Column(nullable = false)
    private int severity;

    @Column(length = 200)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict_status", nullable = false, length = 20)
    @Builder.Default
    private CrisisVerdict verdictStatus = CrisisVerdict.PENDING;

    @Column(name = "verdict_summary", length = 4000)
    private String verdictSummary;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public List<String> keywordList() {
        if (keywords == null || keywords.isBlank()) return List.of();
        return Arrays.stream(keywords.split(","))
                .map(String::strip)
                .filter(k -> !k.isEmpty())
                .toList();
    }

    /** 검색 쿼리용 키워드 문자열(공백 구분) */
    public String keywordQuery() {
        List<String> list = keywordList();
        return list.isEmpty() ? name : String.join(" ", list);
    }
}
