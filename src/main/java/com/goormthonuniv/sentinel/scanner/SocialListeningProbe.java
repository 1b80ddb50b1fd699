package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.Signal;
import com.goormthonuniv.sentinel.enums.SourceKind;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.search.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 고신호 소셜 검색 템플릿을 순서대로 돌린다. 블로킹 호출이므로 탐지 단계가 probe 풀로 넘겨 실행한다.
 */
@Slf4j
@Component
public class SocialListeningProbe {

    static final String SOURCE_NAME = "Social Signal";
    private static final SearchOptions OPTIONS = SearchOptions.of(5, Recency.DAY);

    private final SearchProvider search;
    private final List<String> queries;

    public SocialListeningProbe(SearchProvider search, SentinelProperties properties) {
        this.search = search;
        this.queries = properties.discovery().socialQueries();
    }

    public List<Signal> listen() {
        List<Signal> out = new ArrayList<>();
        for (String q : queries) {
            try {
                for (SearchResult r : search.text(q, OPTIONS)) {
                    String title = r.title() == null || r.title().isBlank() ? "Social Rumor" : r.title();
                    out.add(new Signal(title, r.snippet(), r.url(), SOURCE_NAME, SourceKind.SOCIAL, r.publishedAt()));
                }
            } catch (RuntimeException e) {
                log.warn("[Social] query '{}' failed: {}", q, e.getMessage());
            }
        }
        log.info("[Social] {} signal(s) from {} template(s)", out.size(), queries.size());
        return out;
    }
}
