package com.tracking.engine.dto;

/**
 * LOCATION records and publishes every accepted fix. GEOFENCE only feeds
 * fixes to geofence evaluation.
 */
public enum TrackingMode {
    LOCATION,
    GEOFENCE
}
