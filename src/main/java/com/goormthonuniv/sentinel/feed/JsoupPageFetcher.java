package com.goormthonuniv.sentinel.feed;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class JsoupPageFetcher implements PageFetcher {

    static final int MAX_TEXT_LENGTH = 50_000;

    private static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64; rv:121.0) Gecko/20100101 Firefox/121.0"
    );

    @Override
    public String fetchText(String url, Duration timeout) throws IOException {
        Document doc = Jsoup.connect(url)
                .userAgent(USER_AGENTS.get(ThreadLocalRandom.current().nextInt(USER_AGENTS.size())))
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                .get();

        // 스크립트/내비게이션 제거
        doc.select("script,noscript,style,header,footer,nav,aside").remove();

        String text = doc.body() == null ? "" : doc.body().text()
                .replace("\u00A0", " ")
                .replaceAll("\\s{2,}", " ")
                .trim();
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }
}
