package com.goormthonuniv.sentinel.verify;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * site: 연산자 쿼리 조립. 출력은 원문 문자열(인코딩 X).
 */
public final class SiteQueryBuilder {

    private SiteQueryBuilder() {}

    /** "keywords (site:a.com OR site:b.com)" */
    public static String siteScoped(String keywords, Collection<String> sites) {
        if (sites.isEmpty()) return keywords;
        String ops = sites.stream().map(s -> "site:" + s).collect(Collectors.joining(" OR "));
        return keywords + " (" + ops + ")";
    }

    /** "keywords (a OR b OR c)" 형태의 문맥 확장 */
    public static String withContext(String keywords, Collection<String> terms) {
        if (terms.isEmpty()) return keywords;
        return keywords + " (" + String.join(" OR ", terms) + ")";
    }
}
