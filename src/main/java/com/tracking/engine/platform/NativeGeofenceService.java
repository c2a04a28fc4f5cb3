package com.tracking.engine.platform;

import com.tracking.engine.dto.GeofenceRegion;

/**
 * Platform geofence monitor with a hard limit on concurrently registered regions.
 */
public interface NativeGeofenceService {

    void register(GeofenceRegion region);

    void unregister(String identifier);

    void unregisterAll();
}
