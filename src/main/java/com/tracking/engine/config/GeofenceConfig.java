package com.tracking.engine.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.time.Duration;

/**
 * Geofence evaluation settings.
 *
 * @param highAccuracy          evaluate transitions in-process from continuous fixes
 * @param maxMonitoredGeofences window size, 0 uses the platform capacity
 * @param dwellDelay            default time inside before DWELL
 * @param initialTriggerEntry   emit ENTER when a region starts being monitored with the device inside
 * @param knockOut              remove a region after its EXIT
 */
@Builder(toBuilder = true)
public record GeofenceConfig(
    Boolean highAccuracy,
    @PositiveOrZero(message = "maxMonitoredGeofences must be >= 0") Integer maxMonitoredGeofences,
    Duration dwellDelay,
    Boolean initialTriggerEntry,
    Boolean knockOut
) {

    public GeofenceConfig {
        if (highAccuracy == null) {
            highAccuracy = Boolean.FALSE;
        }
        if (maxMonitoredGeofences == null) {
            maxMonitoredGeofences = 0;
        }
        if (dwellDelay == null) {
            dwellDelay = Duration.ofMinutes(5);
        }
        if (initialTriggerEntry == null) {
            initialTriggerEntry = Boolean.TRUE;
        }
        if (knockOut == null) {
            knockOut = Boolean.FALSE;
        }
    }

    public static GeofenceConfig defaults() {
        return GeofenceConfig.builder().build();
    }

    /**
     * Window size given the platform's hard limit.
     */
    public int effectiveCapacity(int platformCapacity) {
        return maxMonitoredGeofences > 0
            ? Math.min(maxMonitoredGeofences, platformCapacity)
            : platformCapacity;
    }
}
