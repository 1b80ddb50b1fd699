package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.dto.ExtractedClaim;
import com.goormthonuniv.sentinel.entity.AdHocAnalysis;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.AnalysisStatus;
import com.goormthonuniv.sentinel.exception.NotFoundException;
import com.goormthonuniv.sentinel.scanner.SupervisedTaskSet;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 사용자 제보 분석. 접수 즉시 PENDING 기록을 돌려주고 실제 검증은 백그라운드에서 진행한다.
 * 어떤 이유로든 실패하면 FAILED로 마감한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdHocAnalysisService {

    static final String UNKNOWN_LOCATION = "Unknown";

    private final CrisisStore store;
    private final ClaimExtractionService extraction;
    private final VerificationOrchestrator orchestrator;
    private final SupervisedTaskSet backgroundTasks;

    public AdHocAnalysis submit(String queryText) {
        AdHocAnalysis analysis = store.createAnalysis(queryText.strip());
        UUID id = analysis.getId();
        if (!backgroundTasks.submit("adhoc:" + id, () -> process(id))) {
            analysis.setStatus(AnalysisStatus.FAILED);
            analysis.setReasoningTrace("Analysis queue is full. Please retry later.");
            return store.saveAnalysis(analysis);
        }
        return analysis;
    }

    public AdHocAnalysis get(UUID id) {
        return store.findAnalysis(id).orElseThrow(() -> new NotFoundException("Analysis not found: " + id));
    }

    void process(UUID id) {
        Optional<AdHocAnalysis> found = store.findAnalysis(id);
        if (found.isEmpty()) return;
        AdHocAnalysis analysis = found.get();
        try {
            analysis.setStatus(AnalysisStatus.PROCESSING);
            analysis = store.saveAnalysis(analysis);

            ExtractedClaim claim = bestClaim(analysis.getQueryText());
            String key = VerificationOrchestrator.normalizeClaim(claim.text());
            Optional<TimelineItem> item = orchestrator.run(claim.text(), claim.location(), null);
            if (item.isEmpty()) {
                // 이미 검증된 주장이면 기존 기록을 그대로 쓴다
                item = store.findTimelineItem(null, key);
            }
            if (item.isEmpty()) {
                throw new IllegalStateException("Same claim is being verified by another request");
            }
            complete(analysis, item.get());
        } catch (RuntimeException e) {
            log.error("[AdHoc] analysis {} failed: {}", id, e.toString());
            analysis.setStatus(AnalysisStatus.FAILED);
            analysis.setReasoningTrace("Analysis failed: " + e.getMessage());
            store.saveAnalysis(analysis);
        }
    }

    /** 추출된 첫 주장, 없거나 추출 실패면 원문 그대로 */
    private ExtractedClaim bestClaim(String query) {
        try {
            List<ExtractedClaim> claims = extraction.extract(query);
            if (!claims.isEmpty()) return claims.get(0);
        } catch (RuntimeException e) {
            log.warn("[AdHoc] claim extraction failed, using raw query: {}", e.getMessage());
        }
        return new ExtractedClaim(query, UNKNOWN_LOCATION);
    }

    private void complete(AdHocAnalysis analysis, TimelineItem item) {
        analysis.setVerdictStatus(item.getStatus());
        analysis.setVerdictSummary(item.getSummary());
        analysis.setVerdictSources(new ArrayList<>(item.getSources()));
        analysis.setConfidenceScore(item.getConfidenceScore());
        analysis.setReasoningTrace(item.getReasoningTrace());
        analysis.setStatus(AnalysisStatus.COMPLETED);
        store.saveAnalysis(analysis);
        log.info("[AdHoc] analysis {} -> {} ({}%) '{}'", analysis.getId(), item.getStatus(),
                item.getConfidenceScore(), TextUtils.truncate(item.getClaimText(), 60));
    }
}
