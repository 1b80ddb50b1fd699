package com.goormthonuniv.sentinel.agent;

import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.enums.EvidenceKind;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.service.KeywordService;
import com.goormthonuniv.sentinel.verify.SiteQueryBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * 주류 언론 교차 확인 + 바이럴/루머 문맥 검색. 같은 URL은 처음 것만 남긴다.
 */
@Component
public class MediaCrossReferenceAgent extends AbstractEvidenceAgent {

    static final int KEYWORD_LIMIT = 7;
    static final String VAGUE = "Claim text insufficient for media extraction.";
    static final String NONE = "No confirmation found in trusted mainstream media outlets (This often indicates a rumor).";

    public MediaCrossReferenceAgent(SearchProvider search, KeywordService keywordService, SentinelProperties properties,
                                    @Qualifier(ExecutorConfig.PROBE_EXECUTOR) ExecutorService probeExecutor) {
        super(search, keywordService, properties, probeExecutor);
    }

    @Override public EvidenceKind kind() { return EvidenceKind.MEDIA; }

    @Override protected String noEvidenceMessage() { return NONE; }

    @Override
    protected List<EvidenceItem> collect(String claimText) {
        String query = keywordService.buildQuery(keywordService.extract(claimText, config.mediaStopWords(), KEYWORD_LIMIT));
        if (query.isEmpty()) return List.of(EvidenceItem.none(kind(), VAGUE));

        List<EvidenceItem> combined = joinAll(List.of(
                probe("trusted-media",
                        () -> textSearch(SiteQueryBuilder.siteScoped(query, config.mediaDomains()), SearchOptions.of(5, Recency.MONTH))),
                probe("viral-context",
                        () -> textSearch(SiteQueryBuilder.withContext(query, config.viralContextTerms()), SearchOptions.of(4, Recency.MONTH)))
        ));
        return dedupByUrl(combined);
    }

    static List<EvidenceItem> dedupByUrl(List<EvidenceItem> items) {
        Set<String> seen = new HashSet<>();
        List<EvidenceItem> out = new ArrayList<>();
        for (EvidenceItem e : items) {
            if (e.url() == null || seen.add(e.url())) out.add(e);
        }
        return out;
    }
}
