package com.tracking.engine.service;

import com.tracking.engine.config.RetentionConfig;
import com.tracking.engine.repository.TrackingRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Age and count limits on the record store.
 *
 * Passes, always in this order:
 * 1. Age: delete records created more than {@code maxDaysToPersist} days ago
 * 2. Count: keep only the {@code maxRecordsToPersist} newest records
 *
 * Runs after inserts (asynchronously), on an hourly sweep so age limits apply
 * while the device is idle, and on demand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionService {

    private final TrackingRecordRepository recordRepository;
    private final Clock clock;

    private volatile RetentionConfig activeConfig;

    /**
     * Retention settings used by the periodic sweep.
     */
    public void activate(RetentionConfig config) {
        this.activeConfig = config;
    }

    @Async("pruneExecutor")
    public CompletableFuture<Integer> enforceAsync(RetentionConfig config) {
        try {
            return CompletableFuture.completedFuture(enforce(config));
        } catch (RuntimeException e) {
            log.error("Background retention pass failed", e);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Runs both passes.
     *
     * @return number of records deleted
     */
    public synchronized int enforce(RetentionConfig config) {
        int deletedByAge = 0;
        int deletedByCount = 0;

        if (config.ageLimitEnabled()) {
            Instant cutoff = clock.instant().minus(Duration.ofDays(config.maxDaysToPersist()));
            deletedByAge = recordRepository.deleteCreatedBefore(cutoff);
        }

        if (config.countLimitEnabled()) {
            // the (max+1)-th newest id and everything older goes
            List<Long> cutoffId = recordRepository.findIdsNewestFirst(PageRequest.of(config.maxRecordsToPersist(), 1));
            if (!cutoffId.isEmpty()) {
                deletedByCount = recordRepository.deleteUpToId(cutoffId.get(0));
            }
        }

        if (deletedByAge + deletedByCount > 0) {
            log.info("Retention pruned {} records ({} by age, {} by count)",
                    deletedByAge + deletedByCount, deletedByAge, deletedByCount);
        }
        return deletedByAge + deletedByCount;
    }

    @Scheduled(fixedRateString = "${tracking.retention.sweep-interval-minutes:60}",
               initialDelayString = "${tracking.retention.sweep-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES)
    public void scheduledSweep() {
        RetentionConfig config = activeConfig;
        if (config == null || !(config.ageLimitEnabled() || config.countLimitEnabled())) {
            return;
        }
        try {
            enforce(config);
        } catch (RuntimeException e) {
            log.error("Scheduled retention sweep failed", e);
        }
    }
}
