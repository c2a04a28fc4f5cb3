package com.tracking.engine.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracking.engine.entity.RecordKind;

import java.time.Instant;

/**
 * A stored record as returned by queries and sent by the sync pipeline.
 * {@code body} is the stored JSON, or the configured template rendered against it.
 */
public record RecordView(
    Long id,
    String uuid,
    RecordKind kind,
    Instant recordedAt,
    Instant createdAt,
    boolean synced,
    JsonNode body
) {
}
