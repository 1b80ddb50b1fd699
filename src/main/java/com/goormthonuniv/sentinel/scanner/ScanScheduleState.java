package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.entity.Crisis;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 심층 수집 스케줄 상태: 위기별 마지막 스캔 시각 + 일반 위험군 라운드로빈 커서.
 * 커서는 매 틱 현재 일반 위험군 크기로 나눈 나머지로 맞춘다(집합 크기가 틱마다 바뀔 수 있음).
 */
public class ScanScheduleState {

    private final int highRiskSeverity;
    private final Duration highRiskInterval;
    private final int capacity;

    private final Map<UUID, Instant> lastScan = new HashMap<>();
    private int cursor = 0;

    public ScanScheduleState(int highRiskSeverity, Duration highRiskInterval, int capacity) {
        this.highRiskSeverity = highRiskSeverity;
        this.highRiskInterval = highRiskInterval;
        this.capacity = capacity;
    }

    /**
     * 이번 틱 배치.
     * 고위험군은 마지막 스캔 후 간격을 넘긴 것만, 오래된 순으로 상한까지. 남은 자리는 일반 위험군을 커서부터 순환하며 채운다.
     */
    public synchronized List<Crisis> planBatch(List<Crisis> tracked, Instant now) {
        List<Crisis> high = new ArrayList<>();
        List<Crisis> normal = new ArrayList<>();
        for (Crisis c : tracked) {
            if (c.getSeverity() >= highRiskSeverity) high.add(c);
            else normal.add(c);
        }

        List<Crisis> batch = high.stream()
                .filter(c -> isDue(c.getId(), now))
                .sorted(Comparator.comparing((Crisis c) -> lastScan.getOrDefault(c.getId(), Instant.MIN)))
                .limit(capacity)
                .collect(Collectors.toCollection(ArrayList::new));

        int slots = Math.min(capacity - batch.size(), normal.size());
        if (slots > 0) {
            cursor = cursor % normal.size();
            for (int i = 0; i < slots; i++) {
                batch.add(normal.get(cursor));
                cursor = (cursor + 1) % normal.size();
            }
        }
        return batch;
    }

    /** 디스패치 전에 기록해야 느린 이전 디스패치와 같은 항목이 중복 편성되지 않는다 */
    public synchronized void markScanned(Collection<Crisis> batch, Instant now) {
        for (Crisis c : batch) lastScan.put(c.getId(), now);
    }

    public synchronized Optional<Instant> lastScan(UUID crisisId) {
        return Optional.ofNullable(lastScan.get(crisisId));
    }

    /** 추적에서 빠진 위기의 기록 정리 */
    public synchronized void retain(Collection<UUID> alive) {
        lastScan.keySet().retainAll(new HashSet<>(alive));
    }

    public synchronized int cursor() {
        return cursor;
    }

    private boolean isDue(UUID id, Instant now) {
        Instant last = lastScan.get(id);
        return last == null || Duration.between(last, now).compareTo(highRiskInterval) > 0;
    }
}
