package com.tracking.engine.config;

import com.tracking.engine.entity.RecordKind;

/**
 * Which record kinds are written to the store.
 */
public enum PersistMode {
    NONE,
    ALL,
    LOCATION,
    GEOFENCE;

    public boolean persists(RecordKind kind) {
        return switch (this) {
            case NONE -> false;
            case ALL -> true;
            case LOCATION -> kind == RecordKind.LOCATION;
            case GEOFENCE -> kind == RecordKind.GEOFENCE;
        };
    }
}
