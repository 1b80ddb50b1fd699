package com.goormthonuniv.sentinel.exception;

/**
 * 현재 자격증명이 속도 제한(HTTP 429)에 걸림. 회전 관리자 내부에서만 처리된다.
 */
public class RateLimitedException extends JudgmentException {

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
