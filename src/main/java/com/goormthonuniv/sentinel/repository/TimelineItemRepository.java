package com.goormthonuniv.sentinel.repository;

import com.goormthonuniv.sentinel.entity.TimelineItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TimelineItemRepository extends JpaRepository<TimelineItem, UUID> {

    Optional<TimelineItem> findFirstByCrisisIdAndClaimText(UUID crisisId, String claimText);

    Optional<TimelineItem> findFirstByCrisisIdIsNullAndClaimText(String claimText);

    List<TimelineItem> findByCrisisIdOrderByTimestampDesc(UUID crisisId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TimelineItem t WHERE t.crisisId IN :crisisIds")
    int deleteByCrisisIds(@Param("crisisIds") Collection<UUID> crisisIds);

    // 삭제된 위기를 가리키는 기록 (crisisId는 FK가 아니다)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TimelineItem t WHERE t.crisisId IS NOT NULL"
            + " AND NOT EXISTS (SELECT c.id FROM Crisis c WHERE c.id = t.crisisId)")
    int deleteOrphans();
}
