package com.goormthonuniv.sentinel.enums;

public enum AnalysisStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
