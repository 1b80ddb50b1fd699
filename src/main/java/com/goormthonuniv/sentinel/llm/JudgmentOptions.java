package com.goormthonuniv.sentinel.llm;

/**
 * 판정 호출 옵션.
 * @param temperature 샘플링 온도
 * @param json        JSON 객체 응답 강제 여부
 */
public record JudgmentOptions(double temperature, boolean json) {

    public static final JudgmentOptions PRECISE_JSON = new JudgmentOptions(0.1, true);
    public static final JudgmentOptions DEFAULT_JSON = new JudgmentOptions(0.3, true);
}
