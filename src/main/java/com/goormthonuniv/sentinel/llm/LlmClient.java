package com.goormthonuniv.sentinel.llm;

import com.goormthonuniv.sentinel.exception.JudgmentException;
import com.goormthonuniv.sentinel.exception.RateLimitedException;

/**
 * 단일 자격증명으로 판정 서비스를 1회 호출한다.
 */
public interface LlmClient {

    /**
     * @throws RateLimitedException 자격증명이 속도 제한에 걸린 경우
     * @throws JudgmentException    그 외 모든 실패(재시도 대상 아님)
     */
    String complete(String apiKey, String model, String prompt, JudgmentOptions options);
}
