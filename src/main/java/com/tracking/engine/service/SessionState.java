package com.tracking.engine.service;

import com.tracking.engine.dto.TrackingMode;

import java.time.Instant;

/**
 * Persisted session-state blob.
 */
public record SessionState(
    boolean enabled,
    TrackingMode trackingMode,
    boolean schedulerEnabled,
    double odometer,
    boolean moving,
    Instant lastFixTime
) {
}
