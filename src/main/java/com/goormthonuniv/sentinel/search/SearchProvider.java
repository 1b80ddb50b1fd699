package com.goormthonuniv.sentinel.search;

import java.util.List;

/**
 * 외부 검색 제공자. 블로킹 호출이므로 호출자는 probe 풀에서 실행한다.
 * 일시적 실패는 재시도 가능한 {@link com.goormthonuniv.sentinel.exception.SearchException},
 * 잘못된 쿼리는 {@link IllegalArgumentException}.
 */
public interface SearchProvider {
    String name();
    List<SearchResult> text(String query, SearchOptions options);
    List<SearchResult> news(String query, SearchOptions options);
}
