package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.CrisisConclusion;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.dto.Verdict;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.SourceRef;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.llm.JudgmentGateway;
import com.goormthonuniv.sentinel.llm.JudgmentOptions;
import com.goormthonuniv.sentinel.llm.Prompts;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 증거 -> 판정, 타임라인 -> 위기 종합 판정.
 */
@Slf4j
@Service
public class VerdictSynthesizer {

    static final int MAX_FALLBACK_SOURCES = 5;
    static final int MAX_TIMELINE_LINES = 30;

    private final JudgmentGateway gateway;
    private final CrisisStore store;
    private final String model;

    public VerdictSynthesizer(JudgmentGateway gateway, CrisisStore store, SentinelProperties properties) {
        this.gateway = gateway;
        this.store = store;
        this.model = properties.judgment().synthesisModel();
    }

    public Verdict synthesize(String claim, String location, List<EvidenceItem> evidence) {
        String lines = evidence.stream().map(EvidenceItem::toPromptLine).collect(Collectors.joining("\n"));
        Verdict v = gateway.generateJson(model, Prompts.verdict(claim, location, lines), JudgmentOptions.DEFAULT_JSON, Verdict.class);
        if (!v.sources().isEmpty()) return v;

        // 모델이 출처를 비워 두면 실제 URL이 있는 증거로 채운다
        List<SourceRef> cited = evidence.stream()
                .filter(e -> !e.isPlaceholder())
                .map(e -> new SourceRef(e.title(), e.url()))
                .limit(MAX_FALLBACK_SOURCES)
                .toList();
        return new Verdict(v.status(), v.summary(), v.confidence(), v.reasoning(), cited);
    }

    /**
     * 위기 타임라인을 종합해 위기의 판정 상태/요약을 갱신한다.
     * @return 위기나 타임라인이 없으면 empty
     */
    public Optional<CrisisConclusion> synthesizeCrisisConclusion(UUID crisisId) {
        Optional<Crisis> crisis = store.findCrisis(crisisId);
        if (crisis.isEmpty()) return Optional.empty();
        List<TimelineItem> timeline = store.listTimeline(crisisId);
        if (timeline.isEmpty()) return Optional.empty();

        String lines = timeline.stream()
                .limit(MAX_TIMELINE_LINES)
                .map(t -> t.getStatus() + " | " + t.getConfidenceScore() + " | " + TextUtils.truncate(t.getClaimText(), 300))
                .collect(Collectors.joining("\n"));
        CrisisConclusion c = gateway.generateJson(model, Prompts.crisisConclusion(crisis.get().getName(), lines),
                JudgmentOptions.DEFAULT_JSON, CrisisConclusion.class);
        store.updateCrisisVerdict(crisisId, c.verdictStatus(), c.verdictSummary());
        log.info("[Synthesis] crisis '{}' -> {}", crisis.get().getName(), c.verdictStatus());
        return Optional.of(c);
    }
}
