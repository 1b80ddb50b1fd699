package com.goormthonuniv.sentinel.search;

public record SearchOptions(int maxResults, Recency recency) {

    public SearchOptions {
        if (maxResults <= 0) throw new IllegalArgumentException("maxResults must be positive");
        recency = recency != null ? recency : Recency.ANY;
    }

    public static SearchOptions of(int maxResults, Recency recency) {
        return new SearchOptions(maxResults, recency);
    }
}
