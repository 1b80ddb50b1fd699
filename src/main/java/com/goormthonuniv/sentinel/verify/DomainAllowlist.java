package com.goormthonuniv.sentinel.verify;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

/**
 * 도메인 허용 목록. 항목은 호스트("reuters.com") 또는 호스트+경로("reuters.com/fact-check") 형태.
 * - "www.", "m.", "mobile.", "amp." 프리픽스 제거
 * - 호스트는 정확 일치 또는 서픽스(".reuters.com") 일치
 * - 경로가 있는 항목은 URL 경로가 그 경로로 시작해야 일치
 */
public final class DomainAllowlist {

    private record Entry(String host, String pathPrefix) {}

    private final List<Entry> entries;

    public DomainAllowlist(Collection<String> domains) {
        List<Entry> list = new ArrayList<>();
        for (String d : domains) {
            String s = d.strip().toLowerCase(Locale.ROOT);
            if (s.isEmpty()) continue;
            int slash = s.indexOf('/');
            String host = slash < 0 ? s : s.substring(0, slash);
            String path = slash < 0 ? "" : s.substring(slash);
            list.add(new Entry(stripCommonSubdomainPrefix(host), path));
        }
        this.entries = List.copyOf(list);
    }

    public boolean matches(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) return false;
        String host = stripCommonSubdomainPrefix(uri.getHost().toLowerCase(Locale.ROOT));
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (Entry e : entries) {
            boolean hostOk = host.equals(e.host()) || host.endsWith("." + e.host());
            if (hostOk && (e.pathPrefix().isEmpty() || path.startsWith(e.pathPrefix()))) return true;
        }
        return false;
    }

    private static URI toUri(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String s = urlOrHost.strip();
        if (!s.contains("://")) s = "https://" + s;
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String stripCommonSubdomainPrefix(String host) {
        for (String pref : List.of("www.", "m.", "mobile.", "amp.")) {
            if (host.startsWith(pref)) return host.substring(pref.length());
        }
        return host;
    }
}
