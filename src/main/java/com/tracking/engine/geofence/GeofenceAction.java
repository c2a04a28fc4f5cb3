package com.tracking.engine.geofence;

public enum GeofenceAction {
    ENTER,
    DWELL,
    EXIT
}
