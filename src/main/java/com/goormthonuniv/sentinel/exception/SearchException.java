package com.goormthonuniv.sentinel.exception;

/**
 * 검색 제공자 호출 실패. retryable=false면 즉시 포기한다(잘못된 쿼리 등).
 */
public class SearchException extends RuntimeException {

    private final boolean retryable;

    public SearchException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
