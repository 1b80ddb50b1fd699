package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.agent.EvidenceAgent;
import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.dto.Verdict;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.exception.NotFoundException;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * 주장 1건 -> 판정 기록 1건. 사용자 제보와 심층 수집 모두 이 경로를 지난다.
 * <ol>
 *   <li>같은 범위(위기 또는 사용자 제보)에 같은 주장 기록이 있으면 아무것도 하지 않는다</li>
 *   <li>에이전트 3종을 병렬 실행하고 전부 기다린다 (공식, 언론, 팩트체크 순으로 이어 붙임)</li>
 *   <li>판정 합성 후 타임라인 항목으로 저장</li>
 * </ol>
 */
@Slf4j
@Service
public class VerificationOrchestrator {

    static final int MAX_CLAIM_LENGTH = 2000;

    private final List<EvidenceAgent> agents;
    private final VerdictSynthesizer synthesizer;
    private final CrisisStore store;
    private final ExecutorService agentExecutor;
    private final Clock clock;

    /** 처리 중인 (범위, 주장) 키. 동시 워커가 같은 주장을 중복 저장하지 않도록 */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public VerificationOrchestrator(List<EvidenceAgent> agents,
                                    VerdictSynthesizer synthesizer,
                                    CrisisStore store,
                                    @Qualifier(ExecutorConfig.AGENT_EXECUTOR) ExecutorService agentExecutor,
                                    Clock clock) {
        this.agents = agents.stream().sorted(Comparator.comparing(EvidenceAgent::kind)).toList();
        this.synthesizer = synthesizer;
        this.store = store;
        this.agentExecutor = agentExecutor;
        this.clock = clock;
    }

    /**
     * @param crisisId null이면 사용자 제보 범위
     * @return 새로 저장된 기록. 이미 기록이 있거나 처리 중이면 empty
     */
    public Optional<TimelineItem> run(String claimText, String location, UUID crisisId) {
        String claim = normalizeClaim(claimText);
        if (claim.isEmpty()) throw new IllegalArgumentException("claimText is blank");

        if (store.findTimelineItem(crisisId, claim).isPresent()) {
            log.debug("[Orchestrator] already recorded: '{}'", TextUtils.truncate(claim, 60));
            return Optional.empty();
        }
        String key = crisisId + "|" + claim;
        if (!inFlight.add(key)) {
            log.debug("[Orchestrator] already in flight: '{}'", TextUtils.truncate(claim, 60));
            return Optional.empty();
        }
        try {
            // 첫 조회 뒤 다른 워커가 저장을 마쳤을 수 있다
            if (store.findTimelineItem(crisisId, claim).isPresent()) return Optional.empty();

            log.info("[Orchestrator] verifying '{}' (crisis={})", TextUtils.truncate(claim, 80), crisisId);
            List<EvidenceItem> evidence = gatherEvidence(claim);
            Verdict verdict = synthesizer.synthesize(claim, location, evidence);

            // 수집 도중 선별 단계가 위기를 지웠을 수 있다
            if (crisisId != null && store.findCrisis(crisisId).isEmpty()) {
                log.info("[Orchestrator] crisis {} was pruned; dropping verdict for '{}'", crisisId, TextUtils.truncate(claim, 60));
                return Optional.empty();
            }
            TimelineItem saved;
            try {
                saved = store.createTimelineItem(TimelineItem.builder()
                        .crisisId(crisisId)
                        .claimText(claim)
                        .summary(verdict.summary())
                        .status(verdict.status())
                        .location(location)
                        .sources(new ArrayList<>(verdict.sources()))
                        .confidenceScore(verdict.confidence())
                        .reasoningTrace(verdict.reasoning())
                        .timestamp(clock.instant())
                        .build());
            } catch (NotFoundException e) {
                log.info("[Orchestrator] crisis {} was pruned while saving; verdict dropped", crisisId);
                return Optional.empty();
            }
            log.info("[Orchestrator] {} ({}%) '{}'", verdict.status(), verdict.confidence(), TextUtils.truncate(claim, 60));
            return Optional.of(saved);
        } finally {
            inFlight.remove(key);
        }
    }

    /** 중복 검사와 저장에 쓰는 주장 키 */
    public static String normalizeClaim(String claimText) {
        return TextUtils.truncate(claimText == null ? "" : claimText.strip(), MAX_CLAIM_LENGTH);
    }

    private List<EvidenceItem> gatherEvidence(String claim) {
        List<CompletableFuture<List<EvidenceItem>>> futures = agents.stream()
                .map(a -> CompletableFuture.supplyAsync(() -> a.gather(claim), agentExecutor))
                .toList();
        List<EvidenceItem> out = new ArrayList<>();
        try {
            for (CompletableFuture<List<EvidenceItem>> f : futures) out.addAll(f.join());
        } catch (CompletionException e) {
            // gather는 예외를 던지지 않으므로 여기 오면 풀 거부 등 기반 문제
            throw new IllegalStateException("Evidence agents failed", e.getCause());
        }
        return out;
    }
}
