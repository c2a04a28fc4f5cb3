package com.tracking.engine.dto;

import com.tracking.engine.geofence.GeofenceAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Transition reported by the platform's own geofence monitor.
 */
public record NativeGeofenceEvent(
    @NotBlank String identifier,
    @NotNull GeofenceAction action,
    Instant timestamp
) {
}
