package com.goormthonuniv.sentinel.util;

import java.time.Duration;

/**
 * 스케줄러/루프의 대기 동작. 테스트에서는 MutableClock을 전진시키는 구현으로 대체한다.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
