package com.tracking.engine.config;

import jakarta.validation.Valid;
import lombok.Builder;

/**
 * Immutable configuration snapshot of a tracking session. A session only
 * picks up a new snapshot through an explicit reconfigure.
 *
 * Missing sections fall back to their defaults, so {@code {}} is a valid
 * configuration.
 */
@Builder(toBuilder = true)
public record TrackingConfig(
    @Valid FilterConfig filter,
    @Valid ElasticityConfig elasticity,
    @Valid RetentionConfig retention,
    @Valid SyncConfig sync,
    @Valid ScheduleConfig schedule,
    @Valid MotionConfig motion,
    @Valid GeofenceConfig geofence
) {

    public TrackingConfig {
        if (filter == null) {
            filter = FilterConfig.defaults();
        }
        if (elasticity == null) {
            elasticity = ElasticityConfig.defaults();
        }
        if (retention == null) {
            retention = RetentionConfig.defaults();
        }
        if (sync == null) {
            sync = SyncConfig.defaults();
        }
        if (schedule == null) {
            schedule = ScheduleConfig.defaults();
        }
        if (motion == null) {
            motion = MotionConfig.defaults();
        }
        if (geofence == null) {
            geofence = GeofenceConfig.defaults();
        }
    }

    public static TrackingConfig defaults() {
        return TrackingConfig.builder().build();
    }
}
