package com.tracking.engine.repository;

import com.tracking.engine.entity.TrackingRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for the append-only record log.
 *
 * Retention runs as two bulk deletes: by age on {@code created_at}, then by
 * count using an id cut-off (ids are strictly increasing, so "the N newest"
 * is "every id above the N+1-th newest id").
 */
@Repository
public interface TrackingRecordRepository
        extends JpaRepository<TrackingRecord, Long>, JpaSpecificationExecutor<TrackingRecord> {

    /**
     * Oldest unsynced records first, bounded by the page size.
     */
    List<TrackingRecord> findBySyncedFalseOrderByIdAsc(Pageable pageable);

    long countBySyncedFalse();

    @Modifying
    @Transactional
    @Query("UPDATE TrackingRecord r SET r.synced = true WHERE r.id IN :ids")
    int markSynced(@Param("ids") Collection<Long> ids);

    @Modifying
    @Transactional
    @Query("DELETE FROM TrackingRecord r WHERE r.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);

    /**
     * Ids newest first. Used with an offset page to find the count cut-off.
     */
    @Query("SELECT r.id FROM TrackingRecord r ORDER BY r.id DESC")
    List<Long> findIdsNewestFirst(Pageable pageable);

    @Modifying
    @Transactional
    @Query("DELETE FROM TrackingRecord r WHERE r.id <= :id")
    int deleteUpToId(@Param("id") Long id);
}
