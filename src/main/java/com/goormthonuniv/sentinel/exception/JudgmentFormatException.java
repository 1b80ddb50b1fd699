package com.goormthonuniv.sentinel.exception;

/**
 * 판정 서비스 응답이 기대한 구조와 맞지 않음. 서비스 오류와 동일하게 취급한다.
 */
public class JudgmentFormatException extends JudgmentException {

    public JudgmentFormatException(String message) {
        super(message);
    }

    public JudgmentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
