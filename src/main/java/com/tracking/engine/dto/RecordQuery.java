package com.tracking.engine.dto;

import com.tracking.engine.entity.RecordKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.Instant;

/**
 * Paged record lookup. Null filters match everything.
 *
 * @param from      fix time lower bound, inclusive
 * @param to        fix time upper bound, exclusive
 * @param synced    sync status filter
 * @param kind      record kind filter
 * @param page      zero-based page
 * @param size      page size
 * @param ascending id order
 */
public record RecordQuery(
    Instant from,
    Instant to,
    Boolean synced,
    RecordKind kind,
    @Min(0) int page,
    @Min(1) @Max(1000) int size,
    boolean ascending
) {

    public static RecordQuery firstPage(int size) {
        return new RecordQuery(null, null, null, null, 0, size, true);
    }
}
