package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.util.TextUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 에이전트 공용 키워드 추출.
 * - 소문자화 + 구두점 제거 후 공백 분리
 * - 스톱워드 및 길이 2 이하 토큰 제외
 * - 원문 순서를 유지한 채 앞에서부터 limit개
 */
@Service
public class KeywordService {

    public List<String> extract(String text, Set<String> stopWords, int limit) {
        String cleaned = TextUtils.clean(text);
        if (cleaned.isEmpty() || limit <= 0) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : cleaned.split(" ")) {
            if (t.length() <= 2 || stopWords.contains(t)) continue;
            out.add(t);
            if (out.size() >= limit) break;
        }
        return List.copyOf(out);
    }

    /** 검색 쿼리 문자열. 남은 토큰이 없으면 빈 문자열 */
    public String buildQuery(List<String> keywords) {
        if (keywords.isEmpty()) return "";
        return String.join(" ", keywords);
    }
}
