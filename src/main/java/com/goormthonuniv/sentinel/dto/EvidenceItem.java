package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.enums.EvidenceKind;

/**
 * 에이전트가 돌려주는 출처 표시 증거 조각. url이 null이면 "증거 없음" 안내 항목이다.
 */
public record EvidenceItem(
        EvidenceKind kind,
        String title,
        String url,
        String snippet
) {
    public static EvidenceItem none(EvidenceKind kind, String message) {
        return new EvidenceItem(kind, message, null, "");
    }

    public boolean isPlaceholder() {
        return url == null;
    }

    /** 판정 프롬프트용 한 줄 표현 */
    public String toPromptLine() {
        if (isPlaceholder()) return "[" + kind + "] " + title;
        String s = snippet == null || snippet.isBlank() ? "" : " - " + snippet;
        return "[" + kind + "] " + title + " (" + url + ")" + s;
    }
}
