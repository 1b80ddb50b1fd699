package com.goormthonuniv.sentinel.search;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.exception.SearchException;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Bing Web/News Search v7.
 */
@Component
public class BingSearchProvider implements SearchProvider {

    private static final String KEY_HEADER = "Ocp-Apim-Subscription-Key";

    private final RestClient rest;
    private final SentinelProperties.Search config;

    public BingSearchProvider(RestClient rest, SentinelProperties properties) {
        this.rest = rest;
        this.config = properties.search();
    }

    @Override public String name() { return "bing"; }

    @Override
    public List<SearchResult> text(String query, SearchOptions options) {
        Map<String, Object> res = call(config.webEndpoint(), query, options);
        if (res == null) return List.of();
        Object pages = res.get("webPages");
        if (!(pages instanceof Map<?, ?> webPages)) return List.of();
        return parse(webPages.get("value"), "snippet", "dateLastCrawled");
    }

    @Override
    public List<SearchResult> news(String query, SearchOptions options) {
        Map<String, Object> res = call(config.newsEndpoint(), query, options);
        if (res == null) return List.of();
        return parse(res.get("value"), "description", "datePublished");
    }

    private Map<String, Object> call(String endpoint, String query, SearchOptions options) {
        if (query == null || query.isBlank()) throw new IllegalArgumentException("Search query is blank");
        if (config.apiKey().isBlank()) return null;

        UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(endpoint)
                .queryParam("q", query)
                .queryParam("count", options.maxResults())
                .queryParam("mkt", config.market());
        if (options.recency().freshness() != null) b.queryParam("freshness", options.recency().freshness());
        URI uri = b.encode().build().toUri();

        try {
            return rest.get().uri(uri)
                    .header(KEY_HEADER, config.apiKey())
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.BAD_REQUEST.value()) {
                throw new IllegalArgumentException("Malformed search query: " + query, e);
            }
            boolean retryable = status == HttpStatus.TOO_MANY_REQUESTS.value() || e.getStatusCode().is5xxServerError();
            throw new SearchException("Search failed with HTTP " + status, retryable, e);
        } catch (RestClientException e) {
            throw new SearchException("Search unreachable: " + e.getMessage(), true, e);
        }
    }

    private List<SearchResult> parse(Object valueObj, String snippetField, String dateField) {
        if (!(valueObj instanceof List<?> value)) return List.of();
        List<SearchResult> out = new ArrayList<>();
        for (Object o : value) {
            if (!(o instanceof Map<?, ?> v)) continue;
            String url = str(v.get("url"));
            if (url.isBlank()) continue;
            out.add(new SearchResult(name(), str(v.get("name")), url, str(v.get(snippetField)), parseDate(v.get(dateField))));
        }
        return out;
    }

    private static String str(Object o) {
        return o instanceof String s ? s : "";
    }

    private static OffsetDateTime parseDate(Object o) {
        if (!(o instanceof String s) || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException e) {
            // Bing은 오프셋 없는 날짜를 주기도 한다
            return null;
        }
    }
}
