package com.goormthonuniv.sentinel.feed;

import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.Signal;
import com.goormthonuniv.sentinel.enums.SourceKind;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * RSS 2.0 / Atom 피드 수집기. 피드마다 전용 feed 풀에서 병렬로 가져온다.
 */
@Slf4j
@Component
public class RssFeedAggregator implements FeedAggregator {

    private static final int TIMEOUT_MS = 10_000;

    private final List<String> feedUrls;
    private final ExecutorService feedExecutor;

    public RssFeedAggregator(SentinelProperties properties,
                             @Qualifier(ExecutorConfig.FEED_EXECUTOR) ExecutorService feedExecutor) {
        this.feedUrls = properties.discovery().feedUrls();
        this.feedExecutor = feedExecutor;
    }

    @Override
    public List<Signal> fetchAll() {
        List<CompletableFuture<List<Signal>>> futures = feedUrls.stream()
                .map(url -> CompletableFuture.supplyAsync(() -> fetchOne(url), feedExecutor))
                .toList();
        List<Signal> out = new ArrayList<>();
        for (CompletableFuture<List<Signal>> f : futures) out.addAll(f.join());
        log.info("[Feeds] {} signal(s) from {} feed(s)", out.size(), feedUrls.size());
        return out;
    }

    private List<Signal> fetchOne(String url) {
        try {
            Document doc = Jsoup.connect(url)
                    .ignoreContentType(true)
                    .timeout(TIMEOUT_MS)
                    .parser(Parser.xmlParser())
                    .get();
            return parse(doc, sourceName(doc, url));
        } catch (IOException | RuntimeException e) {
            log.warn("[Feeds] {} failed: {}", url, e.getMessage());
            return List.of();
        }
    }

    static List<Signal> parse(Document doc, String sourceName) {
        List<Signal> out = new ArrayList<>();
        for (Element item : doc.select("item")) {
            out.add(new Signal(
                    item.select("title").text(),
                    TextUtils.stripTags(item.select("description").text()),
                    item.select("link").text(),
                    sourceName, SourceKind.FEED,
                    parseRfc1123(item.select("pubDate").text())));
        }
        for (Element entry : doc.select("entry")) {
            Element link = entry.selectFirst("link[href]");
            out.add(new Signal(
                    entry.select("title").text(),
                    TextUtils.stripTags(entry.select("summary, content").text()),
                    link != null ? link.attr("href") : "",
                    sourceName, SourceKind.FEED,
                    parseIso(entry.select("updated, published").text())));
        }
        return out.stream().filter(s -> !s.url().isBlank() && !s.title().isBlank()).toList();
    }

    private static String sourceName(Document doc, String url) {
        Element title = doc.selectFirst("channel > title, feed > title");
        if (title != null && !title.text().isBlank()) return title.text();
        String host = URI.create(url).getHost();
        return host != null ? host : "Unknown";
    }

    private static OffsetDateTime parseRfc1123(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s.strip(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static OffsetDateTime parseIso(String s) {
        if (s == null || s.isBlank()) return null;
        // updated/published 둘 다 있으면 첫 값만
        String first = s.strip().split("\\s+")[0];
        try {
            return OffsetDateTime.parse(first);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
