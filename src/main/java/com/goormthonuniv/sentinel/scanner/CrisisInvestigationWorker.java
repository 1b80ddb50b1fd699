package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.ExtractedClaim;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.exception.JudgmentFormatException;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.search.SearchResult;
import com.goormthonuniv.sentinel.service.ClaimExtractionService;
import com.goormthonuniv.sentinel.service.VerdictSynthesizer;
import com.goormthonuniv.sentinel.service.VerificationOrchestrator;
import com.goormthonuniv.sentinel.store.CrisisStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 위기 1건 심층 조사: 키워드 쿼리 변형마다 하이브리드 검색 -> 주장 추출 -> 주장별 검증, 끝나면 위기 종합 판정.
 */
@Slf4j
@Component
public class CrisisInvestigationWorker {

    private final SearchProvider search;
    private final ClaimExtractionService extraction;
    private final VerificationOrchestrator orchestrator;
    private final VerdictSynthesizer synthesizer;
    private final CrisisStore store;
    private final SentinelProperties.Gathering config;

    public CrisisInvestigationWorker(SearchProvider search,
                                     ClaimExtractionService extraction,
                                     VerificationOrchestrator orchestrator,
                                     VerdictSynthesizer synthesizer,
                                     CrisisStore store,
                                     SentinelProperties properties) {
        this.search = search;
        this.extraction = extraction;
        this.orchestrator = orchestrator;
        this.synthesizer = synthesizer;
        this.store = store;
        this.config = properties.gathering();
    }

    /** @return 새로 기록된 주장 수 */
    public int investigate(UUID crisisId) {
        Optional<Crisis> found = store.findCrisis(crisisId);
        if (found.isEmpty()) return 0;
        Crisis crisis = found.get();
        log.info("[Deep Scan] worker: {}", crisis.getName());

        int recorded = 0;
        for (String suffix : config.querySuffixes()) {
            String query = crisis.keywordQuery() + suffix;
            for (SearchResult hit : hybridSearch(query)) {
                for (ExtractedClaim claim : extractClaims(hit)) {
                    if (orchestrator.run(claim.text(), claim.location(), crisisId).isPresent()) recorded++;
                }
            }
        }
        synthesizer.synthesizeCrisisConclusion(crisisId);
        return recorded;
    }

    /** 뉴스 우선, 결과가 부족하면 일반 검색으로 보충 */
    List<SearchResult> hybridSearch(String query) {
        List<SearchResult> results = new ArrayList<>();
        try {
            results.addAll(search.news(query, SearchOptions.of(config.hitsPerQuery(), Recency.WEEK)));
        } catch (RuntimeException e) {
            log.debug("[Deep Scan] news search failed for '{}': {}", query, e.getMessage());
        }
        if (results.size() < config.minNewsHits()) {
            try {
                results.addAll(search.text(query, SearchOptions.of(config.hitsPerQuery(), Recency.DAY)));
            } catch (RuntimeException e) {
                log.debug("[Deep Scan] text search failed for '{}': {}", query, e.getMessage());
            }
        }
        return results;
    }

    private List<ExtractedClaim> extractClaims(SearchResult hit) {
        String text = (hit.title() == null ? "" : hit.title()) + " " + (hit.snippet() == null ? "" : hit.snippet());
        try {
            return extraction.extract(text);
        } catch (JudgmentFormatException e) {
            // 형식 불량은 이 기사만 건너뛴다. 한도 소진 등은 워커 전체를 중단
            log.debug("[Deep Scan] extraction output rejected for '{}': {}", hit.url(), e.getMessage());
            return List.of();
        }
    }
}
