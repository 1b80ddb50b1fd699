package com.goormthonuniv.sentinel.util;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.*;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern PUNCT = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private TextUtils() {}

    /** 소문자화 + 구두점 제거 + 공백 정리 */
    public static String clean(String text) {
        if (text == null) return "";
        String t = text.toLowerCase(Locale.ROOT);
        t = PUNCT.matcher(t).replaceAll("");
        return SPACES.matcher(t).replaceAll(" ").strip();
    }

    /** 공백 기준 토큰 집합(bag of words) */
    public static Set<String> tokenSet(String text) {
        String c = clean(text);
        if (c.isEmpty()) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(c.split(" ")));
    }

    public static String stripTags(String s) {
        if (s == null) return "";
        return SPACES.matcher(TAGS.matcher(s).replaceAll(" ")).replaceAll(" ").strip();
    }

    public static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * 위기 이름 퍼지 비교: 정규화 후 동일, 충분히 긴 쪽이 다른 쪽을 포함, 또는 편집거리가 길이의 20% 이내.
     */
    public static boolean similarName(String a, String b) {
        String x = clean(a);
        String y = clean(b);
        if (x.isEmpty() || y.isEmpty()) return false;
        if (x.equals(y)) return true;
        boolean xShorter = x.length() <= y.length();
        String shorter = xShorter ? x : y;
        String longer = xShorter ? y : x;
        if (shorter.length() >= 6 && longer.contains(shorter)) return true;
        int threshold = Math.max(2, longer.length() / 5);
        return LEVENSHTEIN.apply(x, y) <= threshold;
    }

    /** 로그용 API 키 마스킹 */
    public static String mask(String secret) {
        if (secret == null || secret.length() < 10) return "****";
        return secret.substring(0, 4) + "..." + secret.substring(secret.length() - 4);
    }
}
