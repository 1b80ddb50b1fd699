package com.goormthonuniv.sentinel.enums;

public enum SourceKind {
    FEED,
    SOCIAL
}
