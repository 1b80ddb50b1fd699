package com.goormthonuniv.sentinel.enums;

public enum EvidenceKind {
    OFFICIAL,
    MEDIA,
    DEBUNK
}
