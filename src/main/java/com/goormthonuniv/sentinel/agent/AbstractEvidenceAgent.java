package com.goormthonuniv.sentinel.agent;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.search.SearchResult;
import com.goormthonuniv.sentinel.service.KeywordService;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * 에이전트 공통 골격.
 * - 하위 프로브는 probe 풀에서 병렬 실행, 실패한 프로브는 빈 결과로 대체
 * - 결과가 없으면 에이전트별 "증거 없음" 문구 1건
 */
@Slf4j
public abstract class AbstractEvidenceAgent implements EvidenceAgent {

    protected final SearchProvider search;
    protected final KeywordService keywordService;
    protected final SentinelProperties.Agents config;
    private final ExecutorService probeExecutor;

    protected AbstractEvidenceAgent(SearchProvider search, KeywordService keywordService,
                                    SentinelProperties properties, ExecutorService probeExecutor) {
        this.search = search;
        this.keywordService = keywordService;
        this.config = properties.agents();
        this.probeExecutor = probeExecutor;
    }

    @Override
    public final List<EvidenceItem> gather(String claimText) {
        try {
            List<EvidenceItem> items = collect(claimText == null ? "" : claimText);
            if (items.isEmpty()) {
                log.info("[{}] no evidence for '{}'", kind(), TextUtils.truncate(claimText, 60));
                return List.of(EvidenceItem.none(kind(), noEvidenceMessage()));
            }
            log.info("[{}] {} evidence item(s)", kind(), items.size());
            return items;
        } catch (RuntimeException e) {
            log.warn("[{}] agent failed: {}", kind(), e.toString());
            return List.of(EvidenceItem.none(kind(), noEvidenceMessage()));
        }
    }

    /** 실제 수집. 빈 목록이면 호출자가 "증거 없음" 항목으로 바꾼다. */
    protected abstract List<EvidenceItem> collect(String claimText);

    protected abstract String noEvidenceMessage();

    protected CompletableFuture<List<EvidenceItem>> probe(String label, Supplier<List<EvidenceItem>> task) {
        return CompletableFuture.supplyAsync(task, probeExecutor)
                .exceptionally(e -> {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.debug("[{}] probe '{}' failed: {}", kind(), label, cause.toString());
                    return List.of();
                });
    }

    /** 모든 프로브를 기다린 뒤 제출 순서대로 이어 붙인다 */
    protected static List<EvidenceItem> joinAll(List<CompletableFuture<List<EvidenceItem>>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<EvidenceItem> out = new ArrayList<>();
        for (CompletableFuture<List<EvidenceItem>> f : futures) out.addAll(f.join());
        return out;
    }

    protected List<EvidenceItem> textSearch(String query, SearchOptions options) {
        List<EvidenceItem> out = new ArrayList<>();
        for (SearchResult r : search.text(query, options)) {
            out.add(new EvidenceItem(kind(), r.title(), r.url(), TextUtils.truncate(r.snippet(), 200)));
        }
        return out;
    }
}
