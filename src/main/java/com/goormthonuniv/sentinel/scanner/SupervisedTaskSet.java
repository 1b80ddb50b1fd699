package com.goormthonuniv.sentinel.scanner;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 감독 루프가 소유하는 유한 백그라운드 작업 집합.
 * 실행 중 작업을 이름으로 추적하고 실패는 로그로 남긴다. 가득 차면 제출을 거절한다.
 */
@Slf4j
public class SupervisedTaskSet {

    private final Executor executor;
    private final int capacity;
    private final Semaphore permits;
    private final Map<Long, String> running = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();

    public SupervisedTaskSet(Executor executor, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.executor = executor;
        this.capacity = capacity;
        this.permits = new Semaphore(capacity);
    }

    /**
     * @return 접수되면 true, 가득 찼거나 실행기가 거절하면 false
     */
    public boolean submit(String name, Runnable task) {
        if (!permits.tryAcquire()) {
            log.warn("[Tasks] rejected '{}': {} task(s) already running", name, capacity);
            return false;
        }
        long id = sequence.incrementAndGet();
        running.put(id, name);
        try {
            CompletableFuture.runAsync(task, executor).whenComplete((v, e) -> {
                running.remove(id);
                permits.release();
                if (e == null) {
                    completed.incrementAndGet();
                    return;
                }
                failures.incrementAndGet();
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[Tasks] '{}' failed: {}", name, cause.toString(), cause);
            });
            return true;
        } catch (RejectedExecutionException e) {
            running.remove(id);
            permits.release();
            log.warn("[Tasks] executor rejected '{}'", name);
            return false;
        }
    }

    public int inFlight() {
        return running.size();
    }

    public List<String> runningNames() {
        return List.copyOf(running.values());
    }

    public long failureCount() {
        return failures.get();
    }

    public long completedCount() {
        return completed.get();
    }
}
