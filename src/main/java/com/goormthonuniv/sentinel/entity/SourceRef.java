package com.goormthonuniv.sentinel.entity;

/** 판정에 인용된 출처 */
public record SourceRef(String title, String url) {}
