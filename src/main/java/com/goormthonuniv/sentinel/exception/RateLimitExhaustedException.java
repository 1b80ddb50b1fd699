package com.goormthonuniv.sentinel.exception;

/**
 * 풀의 모든 자격증명이 속도 제한에 걸림.
 */
public class RateLimitExhaustedException extends JudgmentException {

    private final int attempts;

    public RateLimitExhaustedException(int attempts, Throwable cause) {
        super("All judgment credentials are rate-limited after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
