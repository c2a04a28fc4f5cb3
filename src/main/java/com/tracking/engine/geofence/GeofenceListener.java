package com.tracking.engine.geofence;

import com.tracking.engine.dto.GeofenceEvent;

/**
 * Output of the {@link GeofenceWindowManager}.
 */
public interface GeofenceListener {

    /**
     * A membership edge was crossed and the region asks to be notified of it.
     */
    void onGeofenceEvent(GeofenceEvent event);

    /**
     * Called once per change of the monitored set, never for a no-op.
     */
    void onMonitoredSetChanged(MonitoredSetChange change);

    /**
     * A region was removed after its EXIT in knock-out mode.
     */
    void onRegionKnockedOut(String identifier);
}
