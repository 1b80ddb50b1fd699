package com.goormthonuniv.sentinel.store;

import com.goormthonuniv.sentinel.entity.AdHocAnalysis;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.Notification;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.AnalysisStatus;
import com.goormthonuniv.sentinel.enums.CrisisVerdict;
import com.goormthonuniv.sentinel.exception.NotFoundException;
import com.goormthonuniv.sentinel.repository.AdHocAnalysisRepository;
import com.goormthonuniv.sentinel.repository.CrisisRepository;
import com.goormthonuniv.sentinel.repository.NotificationRepository;
import com.goormthonuniv.sentinel.repository.TimelineItemRepository;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaCrisisStore implements CrisisStore {

    /** 퍼지 매칭 대상 상한 (추적 집합은 선별 단계에서 10건 내외로 유지된다) */
    private static final int FUZZY_SCAN_LIMIT = 500;

    private final CrisisRepository crisisRepository;
    private final TimelineItemRepository timelineItemRepository;
    private final NotificationRepository notificationRepository;
    private final AdHocAnalysisRepository adHocAnalysisRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Crisis createCrisis(String name, String description, String keywords, int severity, String location) {
        Instant now = clock.instant();
        Crisis crisis = Crisis.builder()
                .name(name)
                .description(description)
                .keywords(keywords)
                .severity(Math.max(0, Math.min(100, severity)))
                .location(location)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return crisisRepository.save(crisis);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Crisis> findCrisis(UUID id) {
        return crisisRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Crisis> listCrises(int limit) {
        return crisisRepository.findTracked(PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Crisis> findByFuzzyName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return crisisRepository.findTracked(PageRequest.of(0, FUZZY_SCAN_LIMIT)).stream()
                .filter(c -> TextUtils.similarName(c.getName(), name))
                .findFirst();
    }

    @Override
    @Transactional
    public int retainOnly(Collection<UUID> keepIds) {
        if (keepIds == null || keepIds.isEmpty()) {
            throw new IllegalArgumentException("keepIds must not be empty");
        }
        List<UUID> doomed = crisisRepository.findIdsNotIn(keepIds);
        return deleteCrises(doomed);
    }

    @Override
    @Transactional
    public int deleteCrisesOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int removed = deleteCrises(crisisRepository.findIdsCreatedBefore(cutoff));
        int orphans = timelineItemRepository.deleteOrphans();
        if (orphans > 0) log.info("[Store] removed {} orphaned timeline item(s)", orphans);
        return removed;
    }

    private int deleteCrises(List<UUID> ids) {
        if (ids.isEmpty()) return 0;
        int items = timelineItemRepository.deleteByCrisisIds(ids);
        int removed = crisisRepository.deleteByIds(ids);
        log.debug("[Store] deleted crises={} timelineItems={}", removed, items);
        return removed;
    }

    @Override
    @Transactional
    public void updateCrisisVerdict(UUID crisisId, CrisisVerdict verdict, String summary) {
        crisisRepository.findById(crisisId).ifPresent(c -> {
            c.setVerdictStatus(verdict);
            c.setVerdictSummary(summary);
            c.setUpdatedAt(clock.instant());
        });
    }

    @Override
    @Transactional
    public TimelineItem createTimelineItem(TimelineItem item) {
        if (item.getCrisisId() != null && !crisisRepository.existsById(item.getCrisisId())) {
            throw new NotFoundException("Crisis not found: " + item.getCrisisId());
        }
        if (item.getTimestamp() == null) item.setTimestamp(clock.instant());
        return timelineItemRepository.save(item);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TimelineItem> findTimelineItem(UUID crisisId, String claimText) {
        if (crisisId == null) {
            return timelineItemRepository.findFirstByCrisisIdIsNullAndClaimText(claimText);
        }
        return timelineItemRepository.findFirstByCrisisIdAndClaimText(crisisId, claimText);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TimelineItem> listTimeline(UUID crisisId) {
        return timelineItemRepository.findByCrisisIdOrderByTimestampDesc(crisisId);
    }

    @Override
    @Transactional
    public Notification createNotification(String content, String type, UUID crisisId) {
        return notificationRepository.save(Notification.builder()
                .content(content)
                .notificationType(type)
                .crisisId(crisisId)
                .createdAt(clock.instant())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Notification> latestNotification() {
        return notificationRepository.findFirstByOrderByCreatedAtDesc();
    }

    @Override
    @Transactional
    public AdHocAnalysis createAnalysis(String queryText) {
        return adHocAnalysisRepository.save(AdHocAnalysis.builder()
                .queryText(queryText)
                .status(AnalysisStatus.PENDING)
                .createdAt(clock.instant())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AdHocAnalysis> findAnalysis(UUID id) {
        return adHocAnalysisRepository.findById(id);
    }

    @Override
    @Transactional
    public AdHocAnalysis saveAnalysis(AdHocAnalysis analysis) {
        return adHocAnalysisRepository.save(analysis);
    }
}
