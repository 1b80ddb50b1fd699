package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.Signal;
import com.goormthonuniv.sentinel.enums.SourceKind;
import com.goormthonuniv.sentinel.exception.SearchException;
import com.goormthonuniv.sentinel.search.Recency;
import com.goormthonuniv.sentinel.search.SearchOptions;
import com.goormthonuniv.sentinel.search.SearchProvider;
import com.goormthonuniv.sentinel.search.SearchResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SocialListeningProbeTest {

    @Test
    void runsEveryTemplateAndSurvivesFailures() {
        SearchProvider search = mock(SearchProvider.class);
        when(search.text(eq("q1"), any())).thenThrow(new SearchException("down", true, null));
        when(search.text(eq("q2"), any())).thenReturn(List.of(
                new SearchResult("bing", "", "https://twitter.com/x/1", "forward this now", null)));
        SocialListeningProbe probe = new SocialListeningProbe(search, new SentinelProperties(null, null,
                new SentinelProperties.Discovery(null, null, List.of("q1", "q2"), null, null, null),
                null, null, null, null));

        List<Signal> signals = probe.listen();

        assertEquals(1, signals.size());
        assertEquals("Social Rumor", signals.get(0).title());
        assertEquals("Social Signal", signals.get(0).sourceName());
        assertEquals(SourceKind.SOCIAL, signals.get(0).sourceKind());
        verify(search).text("q2", SearchOptions.of(5, Recency.DAY));
    }
}
