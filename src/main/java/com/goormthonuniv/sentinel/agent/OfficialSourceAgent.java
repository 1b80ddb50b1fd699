package com.goormthonuniv.sentinel.agent;

import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.enums.EvidenceKind;
import com.goormthonuniv.sentinel.feed.PageFetcher;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.service.KeywordService;
import com.goormthonuniv.sentinel.verify.DomainAllowlist;
import com.goormthonuniv.sentinel.verify.SiteQueryBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * 정부/기관 채널 확인.
 * (a) 공식 포털 본문에서 키워드 동시 출현 검사 (b) 공식 도메인 한정 검색 (c) 공식 SNS 계정 한정 검색
 */
@Component
public class OfficialSourceAgent extends AbstractEvidenceAgent {

    static final int KEYWORD_LIMIT = 6;
    static final String VAGUE = "Claim text too vague for official verification.";
    static final String NONE = "No direct confirmation found on monitored government portals or official social media channels.";

    private static final DomainAllowlist SOCIAL_HOSTS = new DomainAllowlist(List.of("twitter.com", "x.com", "facebook.com"));

    private final PageFetcher pageFetcher;

    public OfficialSourceAgent(SearchProvider search, KeywordService keywordService, SentinelProperties properties,
                               PageFetcher pageFetcher,
                               @Qualifier(ExecutorConfig.PROBE_EXECUTOR) ExecutorService probeExecutor) {
        super(search, keywordService, properties, probeExecutor);
        this.pageFetcher = pageFetcher;
    }

    @Override public EvidenceKind kind() { return EvidenceKind.OFFICIAL; }

    @Override protected String noEvidenceMessage() { return NONE; }

    @Override
    protected List<EvidenceItem> collect(String claimText) {
        List<String> keywords = keywordService.extract(claimText, config.officialStopWords(), KEYWORD_LIMIT);
        if (keywords.size() < 2) return List.of(EvidenceItem.none(kind(), VAGUE));
        String query = keywordService.buildQuery(keywords);
        SearchOptions opts = SearchOptions.of(5, Recency.WEEK);

        List<CompletableFuture<List<EvidenceItem>>> probes = new ArrayList<>();
        for (String portal : config.officialPortals()) {
            probes.add(probe(portal, () -> scanPortal(portal, keywords)));
        }
        probes.add(probe("official-domains",
                () -> textSearch(SiteQueryBuilder.siteScoped(query, config.officialDomains()), opts)));
        probes.add(probe("official-handles",
                () -> textSearch(SiteQueryBuilder.siteScoped(query, config.officialHandles()), opts).stream()
                        .filter(e -> SOCIAL_HOSTS.matches(e.url()))
                        .toList()));
        return joinAll(probes);
    }

    /** 키워드가 기준 개수 이상 함께 나오면 첫 일치 지점 주변 문맥을 증거로 */
    List<EvidenceItem> scanPortal(String url, List<String> keywords) {
        String text;
        try {
            text = pageFetcher.fetchText(url, config.portalTimeout()).toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        List<String> found = keywords.stream().filter(text::contains).toList();
        if (found.size() < config.officialMinKeywordHits()) return List.of();

        int idx = text.indexOf(found.get(0));
        String snippet = text.substring(Math.max(0, idx - 50), Math.min(text.length(), idx + 100))
                .replace('\n', ' ').strip();
        return List.of(new EvidenceItem(kind(), "Direct match on " + url, url, "..." + snippet + "..."));
    }
}
