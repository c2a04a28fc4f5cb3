package com.tracking.engine.dto;

import com.tracking.engine.config.TrackingConfig;
import com.tracking.engine.motion.MotionState;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the tracking session, taken on the session thread.
 *
 * @param status                  lifecycle status
 * @param trackingMode            LOCATION or GEOFENCE, null before the first start
 * @param enabled                 sources are running (false outside schedule windows)
 * @param schedulerEnabled        schedule windows drive {@code enabled}
 * @param motionState             current motion classification
 * @param moving                  declared motion state
 * @param odometer                meters
 * @param lastLocation            last accepted fix, optional
 * @param lastFixTime             time of the last accepted fix, optional
 * @param activity                last classified activity, optional
 * @param effectiveDistanceFilter minimum distance currently handed to the provider
 * @param monitoredGeofences      identifiers registered with the platform
 * @param registeredGeofences     number of known regions
 * @param rejectedFixes           fixes that failed a filter check this session
 * @param config                  active configuration, null while unconfigured
 */
public record SessionSnapshot(
    SessionStatus status,
    TrackingMode trackingMode,
    boolean enabled,
    boolean schedulerEnabled,
    MotionState motionState,
    boolean moving,
    double odometer,
    LocationSample lastLocation,
    Instant lastFixTime,
    String activity,
    double effectiveDistanceFilter,
    List<String> monitoredGeofences,
    int registeredGeofences,
    long rejectedFixes,
    TrackingConfig config
) {
}
