package com.tracking.engine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upload settings. A blank {@code url} turns sync off entirely.
 *
 * @param url                       endpoint receiving the records
 * @param method                    POST or PUT
 * @param headers                   extra request headers
 * @param params                    extra top-level body fields
 * @param rootProperty              body property holding the record (or array of records)
 * @param batchSync                 send up to {@code maxBatchSize} records per request
 * @param maxBatchSize              batch size when {@code batchSync} is on
 * @param autoSync                  drain after records are inserted
 * @param autoSyncThreshold         minimum unsynced records before an automatic drain
 * @param timeout                   per-request bound
 * @param disableAutoSyncOnCellular skip automatic drains on cellular transport
 * @param maxAttempts               attempts per batch before it is parked
 * @param initialBackoff            delay before the first retry
 * @param backoffCeiling            upper bound for retry delays
 * @param syncInterval              period of scheduled drains, zero disables them
 */
@Builder(toBuilder = true)
public record SyncConfig(
    String url,
    @Pattern(regexp = "POST|PUT", message = "method must be POST or PUT") String method,
    Map<String, String> headers,
    Map<String, Object> params,
    @NotBlank(message = "rootProperty cannot be blank") String rootProperty,
    Boolean batchSync,
    @Min(value = 1, message = "maxBatchSize must be >= 1") Integer maxBatchSize,
    Boolean autoSync,
    @PositiveOrZero(message = "autoSyncThreshold must be >= 0") Integer autoSyncThreshold,
    Duration timeout,
    Boolean disableAutoSyncOnCellular,
    @Min(value = 1, message = "maxAttempts must be >= 1") Integer maxAttempts,
    Duration initialBackoff,
    Duration backoffCeiling,
    Duration syncInterval
) {

    public SyncConfig {
        if (method == null) {
            method = "POST";
        }
        headers = headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        params = params == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        if (rootProperty == null) {
            rootProperty = "location";
        }
        if (batchSync == null) {
            batchSync = Boolean.FALSE;
        }
        if (maxBatchSize == null) {
            maxBatchSize = 100;
        }
        if (autoSync == null) {
            autoSync = Boolean.TRUE;
        }
        if (autoSyncThreshold == null) {
            autoSyncThreshold = 0;
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(60);
        }
        if (disableAutoSyncOnCellular == null) {
            disableAutoSyncOnCellular = Boolean.FALSE;
        }
        if (maxAttempts == null) {
            maxAttempts = 5;
        }
        if (initialBackoff == null) {
            initialBackoff = Duration.ofSeconds(1);
        }
        if (backoffCeiling == null) {
            backoffCeiling = Duration.ofMinutes(5);
        }
        if (syncInterval == null) {
            syncInterval = Duration.ZERO;
        }
    }

    public static SyncConfig defaults() {
        return SyncConfig.builder().build();
    }

    public boolean enabled() {
        return url != null && !url.isBlank();
    }

    public int effectiveBatchSize() {
        return batchSync ? maxBatchSize : 1;
    }

    public boolean scheduledDrainEnabled() {
        return !syncInterval.isZero() && !syncInterval.isNegative();
    }

    /**
     * Delay before retry number {@code attempt} (1-based): the initial backoff
     * doubled per previous attempt, capped at {@code backoffCeiling}.
     */
    public Duration backoffFor(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 30));
        long millis = initialBackoff.toMillis();
        long ceiling = backoffCeiling.toMillis();
        long delay = millis > (ceiling >> shift) ? ceiling : millis << shift;
        return Duration.ofMillis(Math.min(delay, ceiling));
    }
}
