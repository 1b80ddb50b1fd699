package com.goormthonuniv.sentinel.agent;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.enums.EvidenceKind;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.search.SearchResult;
import com.goormthonuniv.sentinel.service.KeywordService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MediaCrossReferenceAgentTest {

    private final ExecutorService probes = Executors.newFixedThreadPool(2);
    private final SearchProvider search = mock(SearchProvider.class);
    private final MediaCrossReferenceAgent agent = new MediaCrossReferenceAgent(search, new KeywordService(),
            new SentinelProperties(null, null, null, null, null, null,
                    new SentinelProperties.Agents(null, null, null, List.of("reuters.com", "bbc.com"),
                            null, null, List.of("viral", "hoax"), null, null, null, null, null, null)),
            probes);

    @AfterEach
    void tearDown() {
        probes.shutdownNow();
    }

    @Test
    void mergesTrustedAndViralResultsWithoutDuplicateUrls() {
        when(search.text(contains("site:reuters.com"), any())).thenReturn(List.of(
                new SearchResult("bing", "Dam intact", "https://reuters.com/a", "Officials deny", null)));
        when(search.text(contains("(viral OR hoax)"), any())).thenReturn(List.of(
                new SearchResult("bing", "Dam intact (copy)", "https://reuters.com/a", "dup", null),
                new SearchResult("bing", "Viral clip is old", "https://blog.test/b", "2019", null)));

        List<EvidenceItem> out = agent.gather("Breaking: Dam burst in Pune, 50 feared dead");

        assertEquals(List.of("https://reuters.com/a", "https://blog.test/b"), out.stream().map(EvidenceItem::url).toList());
        assertEquals("Dam intact", out.get(0).title());
        verify(search).text(eq("dam burst pune feared dead (site:reuters.com OR site:bbc.com)"),
                eq(SearchOptions.of(5, Recency.MONTH)));
        verify(search).text(eq("dam burst pune feared dead (viral OR hoax)"), eq(SearchOptions.of(4, Recency.MONTH)));
    }

    @Test
    void emptyKeywordsGiveInsufficientMessage() {
        List<EvidenceItem> out = agent.gather("it is a viral video");

        assertEquals(1, out.size());
        assertEquals(MediaCrossReferenceAgent.VAGUE, out.get(0).title());
        verifyNoInteractions(search);
    }

    @Test
    void noCoverageGivesRumorHint() {
        List<EvidenceItem> out = agent.gather("Dam burst in Pune");

        assertEquals(1, out.size());
        assertEquals(EvidenceKind.MEDIA, out.get(0).kind());
        assertEquals(MediaCrossReferenceAgent.NONE, out.get(0).title());
    }

    @Test
    void dedupKeepsPlaceholders() {
        EvidenceItem a = new EvidenceItem(EvidenceKind.MEDIA, "a", "https://x/1", "");
        EvidenceItem b = new EvidenceItem(EvidenceKind.MEDIA, "b", "https://x/1", "");
        EvidenceItem p = EvidenceItem.none(EvidenceKind.MEDIA, "none");

        assertEquals(List.of(a, p, p), MediaCrossReferenceAgent.dedupByUrl(List.of(a, b, p, p)));
    }
}
