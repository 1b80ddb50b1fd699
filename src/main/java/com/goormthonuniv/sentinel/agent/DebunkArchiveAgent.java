package com.goormthonuniv.sentinel.agent;

import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.enums.EvidenceKind;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.search.SearchResult;
import com.goormthonuniv.sentinel.service.KeywordService;
import com.goormthonuniv.sentinel.service.SimilarityService;
import com.goormthonuniv.sentinel.util.TextUtils;
import com.goormthonuniv.sentinel.verify.SiteQueryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * 팩트체크 기관 아카이브 검색. 재유포된 옛 루머를 잡기 위해 최신성 제한을 두지 않는다.
 * 제목 유사도가 임계값 이상이거나 제목/스니펫에 반박 표지어가 있으면 채택.
 */
@Slf4j
@Component
public class DebunkArchiveAgent extends AbstractEvidenceAgent {

    static final int KEYWORD_LIMIT = 6;
    static final int MAX_RESULTS = 8;
    static final String NONE = "No prior fact-checks found for this specific rumor on monitored IFCN databases.";

    private final SimilarityService similarity;

    public DebunkArchiveAgent(SearchProvider search, KeywordService keywordService, SimilarityService similarity,
                              SentinelProperties properties,
                              @Qualifier(ExecutorConfig.PROBE_EXECUTOR) ExecutorService probeExecutor) {
        super(search, keywordService, properties, probeExecutor);
        this.similarity = similarity;
    }

    @Override public EvidenceKind kind() { return EvidenceKind.DEBUNK; }

    @Override protected String noEvidenceMessage() { return NONE; }

    @Override
    protected List<EvidenceItem> collect(String claimText) {
        String query = keywordService.buildQuery(keywordService.extract(claimText, config.debunkStopWords(), KEYWORD_LIMIT));
        if (query.isEmpty()) return List.of();

        String scoped = SiteQueryBuilder.siteScoped(query, config.factCheckDomains());
        return joinAll(List.of(probe("fact-check-archive", () -> accept(claimText, scoped))));
    }

    private List<EvidenceItem> accept(String claimText, String scoped) {
        List<EvidenceItem> out = new ArrayList<>();
        for (SearchResult r : search.text(scoped, SearchOptions.of(MAX_RESULTS, Recency.ANY))) {
            if (isRelevant(claimText, r.title(), r.snippet())) {
                out.add(new EvidenceItem(kind(), r.title(), r.url(), TextUtils.truncate(r.snippet(), 200)));
            } else {
                log.debug("[DEBUNK] skipped low relevance: {}", r.title());
            }
        }
        return out;
    }

    boolean isRelevant(String claimText, String title, String snippet) {
        if (similarity.jaccard(claimText, title) >= config.debunkThreshold()) return true;
        String t = (title == null ? "" : title) + " " + (snippet == null ? "" : snippet);
        String lower = t.toLowerCase(Locale.ROOT);
        return config.debunkMarkers().stream().anyMatch(lower::contains);
    }
}
