package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * 3단계: 주어진 시간 동안 우선순위 가중 배치로 위기별 워커를 돌린다.
 * 배치 크기는 동시 실행 상한을 넘지 않고, 배치 전체를 기다린 뒤 다음 틱으로 간다.
 * 스캔 시각/커서는 주기를 넘어 유지된다.
 */
@Slf4j
@Component
public class DeepGatheringScheduler {

    private final CrisisStore store;
    private final CrisisInvestigationWorker worker;
    private final ExecutorService gatheringExecutor;
    private final SentinelProperties.Gathering config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ScanScheduleState state;

    public DeepGatheringScheduler(CrisisStore store,
                                  CrisisInvestigationWorker worker,
                                  @Qualifier(ExecutorConfig.GATHERING_EXECUTOR) ExecutorService gatheringExecutor,
                                  SentinelProperties properties,
                                  Clock clock,
                                  Sleeper sleeper) {
        this.store = store;
        this.worker = worker;
        this.gatheringExecutor = gatheringExecutor;
        this.config = properties.gathering();
        this.clock = clock;
        this.sleeper = sleeper;
        this.state = new ScanScheduleState(config.highRiskSeverity(), config.highRiskInterval(), config.concurrency());
    }

    /** @return 디스패치한 워커 수 */
    public int run(Duration duration) throws InterruptedException {
        Instant deadline = clock.instant().plus(duration);
        log.info("[Deep Scan] gathering for {}s", duration.toSeconds());
        int dispatched = 0;

        while (clock.instant().isBefore(deadline)) {
            List<Crisis> tracked;
            try {
                tracked = store.listCrises(config.trackedLimit());
            } catch (RuntimeException e) {
                log.error("[Deep Scan] failed to load tracked crises: {}", e.getMessage());
                pause(config.idlePoll(), deadline);
                continue;
            }
            if (tracked.isEmpty()) {
                pause(config.idlePoll(), deadline);
                continue;
            }
            state.retain(tracked.stream().map(Crisis::getId).toList());

            Instant now = clock.instant();
            List<Crisis> batch = state.planBatch(tracked, now);
            if (batch.isEmpty()) {
                pause(config.emptyBatchPause(), deadline);
                continue;
            }

            state.markScanned(batch, now);
            log.info("[Deep Scan] batch: {} item(s)", batch.size());
            dispatch(batch);
            dispatched += batch.size();
            pause(config.tickPause(), deadline);
        }
        log.info("[Deep Scan] window closed, {} worker run(s)", dispatched);
        return dispatched;
    }

    ScanScheduleState state() {
        return state;
    }

    private void dispatch(List<Crisis> batch) throws InterruptedException {
        CompletableFuture<?>[] futures = batch.stream()
                .map(c -> CompletableFuture.runAsync(() -> investigateSafely(c), gatheringExecutor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get();
        } catch (ExecutionException e) {
            log.error("[Deep Scan] batch dispatch failed: {}", e.getCause().toString());
        }
    }

    private void investigateSafely(Crisis crisis) {
        try {
            int n = worker.investigate(crisis.getId());
            log.info("[Deep Scan] '{}' done, {} new claim(s)", crisis.getName(), n);
        } catch (RuntimeException e) {
            log.error("[Deep Scan] worker '{}' failed: {}", crisis.getName(), e.toString());
        }
    }

    /** 남은 시간을 넘겨 자지 않는다 */
    private void pause(Duration d, Instant deadline) throws InterruptedException {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) return;
        sleeper.sleep(d.compareTo(remaining) < 0 ? d : remaining);
    }
}
