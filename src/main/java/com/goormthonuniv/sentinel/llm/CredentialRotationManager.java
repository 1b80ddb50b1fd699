package com.goormthonuniv.sentinel.llm;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.exception.RateLimitExhaustedException;
import com.goormthonuniv.sentinel.exception.RateLimitedException;
import com.goormthonuniv.sentinel.util.Sleeper;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 판정 서비스 자격증명 풀을 돌려 쓰는 관리자.
 * <p>
 * 속도 제한을 만나면 회전 구간(lock)을 잡고 활성 인덱스를 (i+1) mod N으로 옮긴 뒤 잠깐 쉬고 재시도한다.
 * 호출 1회당 시도 횟수는 풀 크기와 같고, 모두 실패하면 {@link RateLimitExhaustedException}.
 * 일반 호출은 lock 없이 병렬로 진행된다. 여러 호출자가 방금 소진된 키로 각자 회전을 일으킬 수 있으며 이는 허용된다.
 */
@Slf4j
@Component
public class CredentialRotationManager {

    private final List<String> credentials;
    private final LlmClient client;
    private final Duration backoff;
    private final Sleeper sleeper;
    private final ReentrantLock rotationLock = new ReentrantLock();

    private volatile int activeIndex = 0;

    public CredentialRotationManager(SentinelProperties properties, LlmClient client, Sleeper sleeper) {
        this.credentials = List.copyOf(properties.judgment().apiKeys());
        if (credentials.isEmpty()) {
            throw new IllegalStateException("No judgment API keys configured (sentinel.judgment.api-keys)");
        }
        this.client = client;
        this.backoff = properties.judgment().rotationBackoff();
        this.sleeper = sleeper;
        log.info("[Rotation] pool size={} active=#1 ({})", credentials.size(), TextUtils.mask(credentials.get(0)));
    }

    public String invoke(String model, String prompt, JudgmentOptions options) {
        int maxAttempts = credentials.size();
        RateLimitedException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String key = credentials.get(activeIndex);
            try {
                return client.complete(key, model, prompt, options);
            } catch (RateLimitedException e) {
                last = e;
                if (attempt < maxAttempts) {
                    rotate();
                    pause();
                }
            }
        }
        log.error("[Rotation] all {} credentials are rate-limited", maxAttempts);
        throw new RateLimitExhaustedException(maxAttempts, last);
    }

    private void rotate() {
        rotationLock.lock();
        try {
            int prev = activeIndex;
            activeIndex = (prev + 1) % credentials.size();
            log.warn("[Rotation] rate limit on key #{}; switching to key #{} ({})",
                    prev + 1, activeIndex + 1, TextUtils.mask(credentials.get(activeIndex)));
        } finally {
            rotationLock.unlock();
        }
    }

    private void pause() {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitedException("Interrupted during rotation backoff", e);
        }
    }

    int activeIndex() {
        return activeIndex;
    }
}
