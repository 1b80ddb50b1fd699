package com.goormthonuniv.sentinel.repository;

import com.goormthonuniv.sentinel.entity.Crisis;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CrisisRepository extends JpaRepository<Crisis, UUID> {

    /**
     * 추적 중인 위기 목록(심각도 내림차순, 최신순)
     */
    @Query("SELECT c FROM Crisis c ORDER BY c.severity DESC, c.createdAt DESC")
    List<Crisis> findTracked(Pageable pageable);

    @Query("SELECT c.id FROM Crisis c WHERE c.createdAt < :cutoff")
    List<UUID> findIdsCreatedBefore(@Param("cutoff") Instant cutoff);

    @Query("SELECT c.id FROM Crisis c WHERE c.id NOT IN :keep")
    List<UUID> findIdsNotIn(@Param("keep") Collection<UUID> keep);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Crisis c WHERE c.id IN :ids")
    int deleteByIds(@Param("ids") Collection<UUID> ids);
}
