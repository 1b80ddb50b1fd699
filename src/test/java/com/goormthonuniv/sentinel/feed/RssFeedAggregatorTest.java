package com.goormthonuniv.sentinel.feed;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.Signal;
import com.goormthonuniv.sentinel.enums.SourceKind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RssFeedAggregatorTest {

    private static Document xml(String s) {
        return Jsoup.parse(s, "", Parser.xmlParser());
    }

    @Test
    void parsesRssItems() {
        Document doc = xml("""
                <rss version="2.0"><channel>
                  <title>World News</title>
                  <item>
                    <title>Explosion reported at chemical plant</title>
                    <link>https://news.test/a</link>
                    <description><![CDATA[<p>Residents told to <b>stay indoors</b></p>]]></description>
                    <pubDate>Mon, 01 Jul 2024 06:00:00 GMT</pubDate>
                  </item>
                  <item>
                    <title>Missing link is skipped</title>
                  </item>
                </channel></rss>""");

        List<Signal> signals = RssFeedAggregator.parse(doc, "World News");

        assertEquals(1, signals.size());
        Signal s = signals.get(0);
        assertEquals("Explosion reported at chemical plant", s.title());
        assertEquals("https://news.test/a", s.url());
        assertEquals("Residents told to stay indoors", s.body());
        assertEquals(SourceKind.FEED, s.sourceKind());
        assertEquals("World News", s.sourceName());
        assertEquals(OffsetDateTime.parse("2024-07-01T06:00:00Z").toInstant(), s.publishedAt().toInstant());
    }

    @Test
    void parsesAtomEntries() {
        Document doc = xml("""
                <feed xmlns="http://www.w3.org/2005/Atom">
                  <title>Atom Feed</title>
                  <entry>
                    <title>Flood warning issued</title>
                    <link href="https://atom.test/1"/>
                    <summary>River above danger mark</summary>
                    <updated>2024-07-01T05:00:00Z</updated>
                  </entry>
                </feed>""");

        List<Signal> signals = RssFeedAggregator.parse(doc, "Atom Feed");

        assertEquals(1, signals.size());
        assertEquals("https://atom.test/1", signals.get(0).url());
        assertEquals("River above danger mark", signals.get(0).body());
        assertNotNull(signals.get(0).publishedAt());
    }

    @Test
    void badDatesAreTolerated() {
        Document doc = xml("""
                <rss><channel><item>
                  <title>Rumor</title><link>https://x.test/1</link><pubDate>yesterday</pubDate>
                </item></channel></rss>""");

        assertNull(RssFeedAggregator.parse(doc, "x").get(0).publishedAt());
    }

    @Test
    void unreachableFeedsContributeNothingWhenCalledFromABusyPool() throws Exception {
        SentinelProperties props = new SentinelProperties(null, null,
                new SentinelProperties.Discovery(null, List.of("http://127.0.0.1:1/rss", "not a url"), null, null, null, null),
                null, null, null, null);
        ExecutorService feedPool = Executors.newFixedThreadPool(2);
        ExecutorService callerPool = Executors.newSingleThreadExecutor();
        try {
            RssFeedAggregator aggregator = new RssFeedAggregator(props, feedPool);

            // 호출 스레드가 유일한 스레드여도 피드 작업은 전용 풀에서 끝난다
            List<Signal> signals = callerPool.submit(aggregator::fetchAll).get(30, TimeUnit.SECONDS);

            assertTrue(signals.isEmpty());
        } finally {
            feedPool.shutdownNow();
            callerPool.shutdownNow();
        }
    }
}
