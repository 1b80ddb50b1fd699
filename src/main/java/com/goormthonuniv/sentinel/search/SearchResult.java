package com.goormthonuniv.sentinel.search;

import java.time.OffsetDateTime;

public record SearchResult(
        String source,      // 제공자명
        String title,
        String url,
        String snippet,
        OffsetDateTime publishedAt
) {}
