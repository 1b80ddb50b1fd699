package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.enums.SourceKind;

import java.time.OffsetDateTime;

/** 탐지용 원시 신호. 저장하지 않고 한 틱 안에서 소비한다. */
public record Signal(
        String title,
        String body,
        String url,
        String sourceName,
        SourceKind sourceKind,
        OffsetDateTime publishedAt   // 알 수 없으면 null
) {}
