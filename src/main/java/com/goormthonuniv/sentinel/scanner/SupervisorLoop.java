package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 자율 감독 루프. 한 주기 = 탐지(고정 윈도우) -> 선별 -> 심층 수집(남은 예산) -> 오래된 위기 정리 -> 쿨다운.
 * 단계 예외는 로그만 남기고 다음 단계로 넘어간다. 프로세스 종료(컨텍스트 close) 때만 멈춘다.
 */
@Slf4j
@Component
public class SupervisorLoop implements SmartLifecycle {

    @FunctionalInterface
    interface StageAction {
        void run() throws InterruptedException;
    }

    private final ThreatDiscoveryStage discovery;
    private final PrioritySelectionStage selection;
    private final DeepGatheringScheduler gathering;
    private final CrisisStore store;
    private final SupervisedTaskSet backgroundTasks;
    private final SentinelProperties.Cycle config;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile boolean running = false;
    private volatile Thread thread;
    private final AtomicLong cycles = new AtomicLong();

    public SupervisorLoop(ThreatDiscoveryStage discovery,
                          PrioritySelectionStage selection,
                          DeepGatheringScheduler gathering,
                          CrisisStore store,
                          SupervisedTaskSet backgroundTasks,
                          SentinelProperties properties,
                          Clock clock,
                          Sleeper sleeper) {
        this.discovery = discovery;
        this.selection = selection;
        this.gathering = gathering;
        this.store = store;
        this.backgroundTasks = backgroundTasks;
        this.config = properties.cycle();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * 프로세스 진입점. 인터럽트될 때까지 주기를 반복한다.
     * 라이프사이클로 띄운 경우 {@link #stop()}이 스레드를 인터럽트한다.
     */
    public void run() {
        log.info("--- Sentinel supervisor started (period {}m) ---", config.period().toMinutes());
        while (!Thread.currentThread().isInterrupted()) {
            try {
                runCycle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("--- Sentinel supervisor stopped after {} cycle(s) ---", cycles.get());
    }

    public void runCycle() throws InterruptedException {
        Instant start = clock.instant();
        long n = cycles.get() + 1;
        log.info(">>> cycle {}: DISCOVERY <<<", n);
        guard("discovery", discovery::run);

        Duration elapsed = Duration.between(start, clock.instant());
        if (elapsed.compareTo(config.discoveryWindow()) < 0) {
            sleeper.sleep(config.discoveryWindow().minus(elapsed));
        }

        log.info(">>> cycle {}: SELECTION <<<", n);
        guard("selection", selection::run);

        log.info(">>> cycle {}: DEEP GATHERING <<<", n);
        guard("gathering", () -> gathering.run(config.gatheringBudget()));

        guard("cleanup", () -> {
            int removed = store.deleteCrisesOlderThan(config.staleAfter());
            if (removed > 0) log.info("[Cycle] removed {} stale crisis(es)", removed);
        });

        cycles.incrementAndGet();
        log.info("[Cycle] done; background tasks running={} completed={} failed={}",
                backgroundTasks.inFlight(), backgroundTasks.completedCount(), backgroundTasks.failureCount());
        sleeper.sleep(config.cooldown());
    }

    public long cycles() {
        return cycles.get();
    }

    private void guard(String stage, StageAction action) throws InterruptedException {
        try {
            action.run();
        } catch (InterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Cycle] stage '{}' failed: {}", stage, e.toString(), e);
        }
    }

    // ===== lifecycle =====

    @Override
    public void start() {
        if (!config.enabled()) {
            log.info("Sentinel supervisor disabled (sentinel.cycle.enabled=false)");
            return;
        }
        running = true;
        Thread t = new Thread(this::run, "sentinel-supervisor");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    @Override
    public void stop() {
        running = false;
        Thread t = thread;
        if (t != null) t.interrupt();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
