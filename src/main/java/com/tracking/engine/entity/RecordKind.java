package com.tracking.engine.entity;

public enum RecordKind {
    LOCATION,
    GEOFENCE
}
