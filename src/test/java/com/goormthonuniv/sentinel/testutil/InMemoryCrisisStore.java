package com.goormthonuniv.sentinel.testutil;

import com.goormthonuniv.sentinel.entity.AdHocAnalysis;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.Notification;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.AnalysisStatus;
import com.goormthonuniv.sentinel.enums.CrisisVerdict;
import com.goormthonuniv.sentinel.exception.NotFoundException;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.TextUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 단위 테스트용 메모리 저장소. 정렬/퍼지 매칭/삭제 규칙은 JPA 구현과 같다.
 */
public class InMemoryCrisisStore implements CrisisStore {

    private static final Comparator<Crisis> TRACKED_ORDER = Comparator
            .comparingInt(Crisis::getSeverity).reversed()
            .thenComparing(Crisis::getCreatedAt, Comparator.reverseOrder());

    private final Clock clock;
    private final Map<UUID, Crisis> crises = new LinkedHashMap<>();
    private final List<TimelineItem> timeline = new ArrayList<>();
    private final List<Notification> notifications = new ArrayList<>();
    private final Map<UUID, AdHocAnalysis> analyses = new LinkedHashMap<>();

    public InMemoryCrisisStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Crisis createCrisis(String name, String description, String keywords, int severity, String location) {
        Instant now = clock.instant();
        Crisis crisis = Crisis.builder()
                .id(UUID.randomUUID())
                .name(name)
                .description(description)
                .keywords(keywords)
                .severity(Math.max(0, Math.min(100, severity)))
                .location(location)
                .createdAt(now)
                .updatedAt(now)
                .build();
        crises.put(crisis.getId(), crisis);
        return crisis;
    }

    @Override
    public synchronized Optional<Crisis> findCrisis(UUID id) {
        return Optional.ofNullable(crises.get(id));
    }

    @Override
    public synchronized List<Crisis> listCrises(int limit) {
        return crises.values().stream().sorted(TRACKED_ORDER).limit(Math.max(1, limit)).toList();
    }

    @Override
    public synchronized Optional<Crisis> findByFuzzyName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return crises.values().stream()
                .sorted(TRACKED_ORDER)
                .filter(c -> TextUtils.similarName(c.getName(), name))
                .findFirst();
    }

    @Override
    public synchronized int retainOnly(Collection<UUID> keepIds) {
        if (keepIds == null || keepIds.isEmpty()) {
            throw new IllegalArgumentException("keepIds must not be empty");
        }
        Set<UUID> doomed = new HashSet<>(crises.keySet());
        doomed.removeAll(keepIds);
        return delete(doomed);
    }

    @Override
    public synchronized int deleteCrisesOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        Set<UUID> doomed = new HashSet<>();
        crises.values().forEach(c -> {
            if (c.getCreatedAt().isBefore(cutoff)) doomed.add(c.getId());
        });
        int removed = delete(doomed);
        timeline.removeIf(t -> t.getCrisisId() != null && !crises.containsKey(t.getCrisisId()));
        return removed;
    }

    private int delete(Set<UUID> ids) {
        timeline.removeIf(t -> t.getCrisisId() != null && ids.contains(t.getCrisisId()));
        int before = crises.size();
        crises.keySet().removeAll(ids);
        return before - crises.size();
    }

    @Override
    public synchronized void updateCrisisVerdict(UUID crisisId, CrisisVerdict verdict, String summary) {
        Crisis c = crises.get(crisisId);
        if (c == null) return;
        c.setVerdictStatus(verdict);
        c.setVerdictSummary(summary);
        c.setUpdatedAt(clock.instant());
    }

    @Override
    public synchronized TimelineItem createTimelineItem(TimelineItem item) {
        if (item.getCrisisId() != null && !crises.containsKey(item.getCrisisId())) {
            throw new NotFoundException("Crisis not found: " + item.getCrisisId());
        }
        if (item.getId() == null) item.setId(UUID.randomUUID());
        if (item.getTimestamp() == null) item.setTimestamp(clock.instant());
        timeline.add(item);
        return item;
    }

    @Override
    public synchronized Optional<TimelineItem> findTimelineItem(UUID crisisId, String claimText) {
        return timeline.stream()
                .filter(t -> Objects.equals(t.getCrisisId(), crisisId))
                .filter(t -> t.getClaimText().equals(claimText))
                .findFirst();
    }

    @Override
    public synchronized List<TimelineItem> listTimeline(UUID crisisId) {
        return timeline.stream()
                .filter(t -> Objects.equals(t.getCrisisId(), crisisId))
                .sorted(Comparator.comparing(TimelineItem::getTimestamp).reversed())
                .toList();
    }

    @Override
    public synchronized Notification createNotification(String content, String type, UUID crisisId) {
        Notification n = Notification.builder()
                .id(UUID.randomUUID())
                .content(content)
                .notificationType(type)
                .crisisId(crisisId)
                .createdAt(clock.instant())
                .build();
        notifications.add(n);
        return n;
    }

    @Override
    public synchronized Optional<Notification> latestNotification() {
        return notifications.isEmpty() ? Optional.empty() : Optional.of(notifications.get(notifications.size() - 1));
    }

    @Override
    public synchronized AdHocAnalysis createAnalysis(String queryText) {
        AdHocAnalysis a = AdHocAnalysis.builder()
                .id(UUID.randomUUID())
                .queryText(queryText)
                .status(AnalysisStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        analyses.put(a.getId(), a);
        return a;
    }

    @Override
    public synchronized Optional<AdHocAnalysis> findAnalysis(UUID id) {
        return Optional.ofNullable(analyses.get(id));
    }

    @Override
    public synchronized AdHocAnalysis saveAnalysis(AdHocAnalysis analysis) {
        analyses.put(analysis.getId(), analysis);
        return analysis;
    }

    public synchronized List<TimelineItem> allTimelineItems() {
        return List.copyOf(timeline);
    }

    public synchronized List<Notification> notifications() {
        return List.copyOf(notifications);
    }

    public synchronized int crisisCount() {
        return crises.size();
    }
}
