package com.goormthonuniv.sentinel.search;

/** 검색 최신성 제한. ANY는 제한 없음 */
public enum Recency {
    DAY("Day"),
    WEEK("Week"),
    MONTH("Month"),
    ANY(null);

    private final String freshness;

    Recency(String freshness) {
        this.freshness = freshness;
    }

    /** Bing freshness 파라미터 값, 제한 없으면 null */
    public String freshness() {
        return freshness;
    }
}
