package com.goormthonuniv.sentinel.config;

import com.goormthonuniv.sentinel.scanner.SupervisedTaskSet;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 동시 실행 풀. 서로 기다리는 계층(워커 -> 에이전트 -> 프로브)마다 풀을 분리해 교착을 막는다.
 */
@Configuration
public class ExecutorConfig {

    public static final String PROBE_EXECUTOR = "probeExecutor";
    public static final String FEED_EXECUTOR = "feedExecutor";
    public static final String AGENT_EXECUTOR = "agentExecutor";
    public static final String GATHERING_EXECUTOR = "gatheringExecutor";
    public static final String BACKGROUND_EXECUTOR = "backgroundExecutor";

    /** 블로킹 검색/포털/피드 호출 */
    @Bean(name = PROBE_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor() {
        return Executors.newFixedThreadPool(16, new CustomizableThreadFactory("sentinel-probe-"));
    }

    /** 피드별 수집. fetchAll 자체가 probe 풀에서 돌기 때문에 따로 둔다 */
    @Bean(name = FEED_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService feedExecutor() {
        return Executors.newFixedThreadPool(4, new CustomizableThreadFactory("sentinel-feed-"));
    }

    /** 오케스트레이터 1회 실행 안의 에이전트 3종 */
    @Bean(name = AGENT_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor() {
        return Executors.newFixedThreadPool(12, new CustomizableThreadFactory("sentinel-agent-"));
    }

    /** 심층 수집 워커. 크기 = 배치 동시 실행 상한 */
    @Bean(name = GATHERING_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService gatheringExecutor(SentinelProperties properties) {
        return Executors.newFixedThreadPool(properties.gathering().concurrency(),
                new CustomizableThreadFactory("sentinel-gather-"));
    }

    /** 탐지 직후 시드 검증, 사용자 제보 분석 */
    @Bean(name = BACKGROUND_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService backgroundExecutor() {
        return Executors.newFixedThreadPool(4, new CustomizableThreadFactory("sentinel-bg-"));
    }

    @Bean
    public SupervisedTaskSet backgroundTasks(@Qualifier(BACKGROUND_EXECUTOR) ExecutorService backgroundExecutor,
                                             SentinelProperties properties) {
        return new SupervisedTaskSet(backgroundExecutor, properties.cycle().backgroundCapacity());
    }
}
