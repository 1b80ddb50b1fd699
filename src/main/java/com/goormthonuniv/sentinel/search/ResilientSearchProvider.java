package com.goormthonuniv.sentinel.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.sentinel.exception.SearchException;
import com.goormthonuniv.sentinel.util.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * 캐시 + 제한 재시도 데코레이터.
 * - 성공 결과만 15분 캐시
 * - 재시도 가능한 실패는 지수 백오프(1s, 2s, 4s ...)로 최대 maxAttempts회
 * - 잘못된 쿼리(IllegalArgumentException)와 재시도 불가 실패는 즉시 전파
 */
@Slf4j
public class ResilientSearchProvider implements SearchProvider {

    private final SearchProvider delegate;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Sleeper sleeper;

    private final Cache<String, List<SearchResult>> cache = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(15))
            .maximumSize(2000)
            .build();

    public ResilientSearchProvider(SearchProvider delegate, int maxAttempts, Duration initialBackoff, Sleeper sleeper) {
        this.delegate = delegate;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.sleeper = sleeper;
    }

    @Override public String name() { return delegate.name(); }

    @Override
    public List<SearchResult> text(String query, SearchOptions options) {
        return cached("text", query, options, () -> delegate.text(query, options));
    }

    @Override
    public List<SearchResult> news(String query, SearchOptions options) {
        return cached("news", query, options, () -> delegate.news(query, options));
    }

    private List<SearchResult> cached(String kind, String query, SearchOptions options, Supplier<List<SearchResult>> call) {
        String key = kind + "|" + options.maxResults() + "|" + options.recency() + "|" + query;
        List<SearchResult> hit = cache.getIfPresent(key);
        if (hit != null) return hit;
        List<SearchResult> result = List.copyOf(withRetry(kind, query, call));
        cache.put(key, result);
        return result;
    }

    private List<SearchResult> withRetry(String kind, String query, Supplier<List<SearchResult>> call) {
        Duration wait = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (SearchException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) throw e;
                log.debug("[Search] {} '{}' attempt {} failed ({}); retrying in {}ms",
                        kind, query, attempt, e.getMessage(), wait.toMillis());
                sleep(wait);
                wait = wait.multipliedBy(2);
            }
        }
    }

    private void sleep(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException("Interrupted during search backoff", false, e);
        }
    }
}
