package com.goormthonuniv.sentinel.store;

import com.goormthonuniv.sentinel.entity.AdHocAnalysis;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.Notification;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.CrisisVerdict;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 영속 계층 경계. 모든 연산은 호출 단위의 짧은 트랜잭션이며 외부 네트워크 호출을 감싸지 않는다.
 */
public interface CrisisStore {

    Crisis createCrisis(String name, String description, String keywords, int severity, String location);

    Optional<Crisis> findCrisis(UUID id);

    /** 심각도 내림차순, 최대 limit건 */
    List<Crisis> listCrises(int limit);

    Optional<Crisis> findByFuzzyName(String name);

    /**
     * keepIds 이외의 위기(및 그 타임라인)를 한 번에 삭제한다.
     * @return 삭제된 위기 수
     */
    int retainOnly(Collection<UUID> keepIds);

    /** 생성 후 age 이상 지난 위기 삭제. 이미 사라진 위기를 가리키는 타임라인도 함께 정리한다 */
    int deleteCrisesOlderThan(Duration age);

    void updateCrisisVerdict(UUID crisisId, CrisisVerdict verdict, String summary);

    /**
     * @throws com.goormthonuniv.sentinel.exception.NotFoundException crisisId가 있는데 해당 위기가 없을 때
     */
    TimelineItem createTimelineItem(TimelineItem item);

    /** 중복 검사: crisisId가 null이면 사용자 제보 범위에서 찾는다 */
    Optional<TimelineItem> findTimelineItem(UUID crisisId, String claimText);

    List<TimelineItem> listTimeline(UUID crisisId);

    Notification createNotification(String content, String type, UUID crisisId);

    Optional<Notification> latestNotification();

    AdHocAnalysis createAnalysis(String queryText);

    Optional<AdHocAnalysis> findAnalysis(UUID id);

    AdHocAnalysis saveAnalysis(AdHocAnalysis analysis);
}
