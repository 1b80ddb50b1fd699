package com.goormthonuniv.sentinel.exception;

/**
 * 판정 서비스 호출 실패. 재시도하지 않는 치명적 오류(잘못된 요청, 정책 차단 등)의 기본형.
 */
public class JudgmentException extends RuntimeException {

    public JudgmentException(String message) {
        super(message);
    }

    public JudgmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
