package com.goormthonuniv.sentinel.enums;

/** 개별 주장(타임라인 항목)의 판정 */
public enum VerificationStatus {
    VERIFIED,
    DEBUNKED,
    UNCONFIRMED
}
