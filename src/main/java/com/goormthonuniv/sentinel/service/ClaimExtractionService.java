package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.ClaimExtraction;
import com.goormthonuniv.sentinel.dto.ExtractedClaim;
import com.goormthonuniv.sentinel.llm.JudgmentGateway;
import com.goormthonuniv.sentinel.llm.JudgmentOptions;
import com.goormthonuniv.sentinel.llm.Prompts;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 비정형 텍스트(기사 스니펫, 사용자 제보)에서 구조화된 주장을 뽑는다.
 * 판정 서비스 예외는 호출자에게 그대로 전파한다.
 */
@Slf4j
@Service
public class ClaimExtractionService {

    static final int MIN_INPUT_LENGTH = 5;
    static final int MAX_INPUT_LENGTH = 30_000;
    static final int MIN_CLAIM_LENGTH = 5;
    static final String UNKNOWN_LOCATION = "Unknown";

    private final JudgmentGateway gateway;
    private final String model;
    private final Clock clock;

    public ClaimExtractionService(JudgmentGateway gateway, SentinelProperties properties, Clock clock) {
        this.gateway = gateway;
        this.model = properties.judgment().extractionModel();
        this.clock = clock;
    }

    public List<ExtractedClaim> extract(String text) {
        if (text == null || text.strip().length() < MIN_INPUT_LENGTH) return List.of();

        String prompt = Prompts.extraction(LocalDate.now(clock).toString(), TextUtils.truncate(text, MAX_INPUT_LENGTH));
        ClaimExtraction result = gateway.generateJson(model, prompt, JudgmentOptions.PRECISE_JSON, ClaimExtraction.class);

        List<ExtractedClaim> claims = result.claims().stream()
                .map(c -> new ExtractedClaim(c.text().strip(), normalizeLocation(c.location())))
                .filter(c -> c.text().length() > MIN_CLAIM_LENGTH)
                .toList();
        log.debug("[Extraction] {} claim(s) from '{}...'", claims.size(), TextUtils.truncate(text, 30));
        return claims;
    }

    private static String normalizeLocation(String location) {
        return location == null || location.isBlank() ? UNKNOWN_LOCATION : location.strip();
    }
}
