package com.goormthonuniv.sentinel.enums;

/** 위기 단위 종합 판정. 최초에는 PENDING */
public enum CrisisVerdict {
    PENDING,
    VERIFIED,
    DEBUNKED,
    UNCONFIRMED,
    MIXED
}
