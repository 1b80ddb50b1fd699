package com.goormthonuniv.sentinel.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.exception.JudgmentException;
import com.goormthonuniv.sentinel.exception.RateLimitedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 호환 chat/completions 엔드포인트 호출.
 */
@Component
public class OpenAiLlmClient implements LlmClient {

    private static final String SYSTEM = "You are a cautious crisis intelligence analyst. Follow the output format exactly.";

    private final RestClient rest;
    private final String endpoint;

    public OpenAiLlmClient(RestClient restClient, SentinelProperties properties) {
        this.rest = restClient;
        this.endpoint = properties.judgment().endpoint();
    }

    @Override
    public String complete(String apiKey, String model, String prompt, JudgmentOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM),
                Map.of("role", "user", "content", prompt)
        ));
        body.put("temperature", options.temperature());
        if (options.json()) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        JsonNode res;
        try {
            res = rest.post()
                    .uri(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new RateLimitedException("Judgment service rate limit: " + e.getStatusText(), e);
            }
            throw new JudgmentException("Judgment service error: " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (RestClientException e) {
            throw new JudgmentException("Judgment service unreachable: " + e.getMessage(), e);
        }

        if (res == null) throw new JudgmentException("Judgment service returned no body");
        JsonNode choices = res.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new JudgmentException("Judgment service returned no choices");
        }
        JsonNode first = choices.get(0);
        if ("content_filter".equals(first.path("finish_reason").asText())) {
            throw new JudgmentException("Judgment blocked by content policy");
        }
        String content = first.path("message").path("content").asText("");
        if (content.isBlank()) throw new JudgmentException("Judgment content empty");
        return content;
    }
}
