package com.tracking.engine.motion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Activity classes reported by the device activity classifier.
 */
public enum ActivityType {

    STILL("still", false),
    WALKING("walking", true),
    RUNNING("running", true),
    ON_FOOT("on_foot", true),
    ON_BICYCLE("on_bicycle", true),
    IN_VEHICLE("in_vehicle", true),
    TILTING("tilting", false),
    UNKNOWN("unknown", false);

    private final String wireName;
    private final boolean moving;

    ActivityType(String wireName, boolean moving) {
        this.wireName = wireName;
        this.moving = moving;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * True for activities that imply the device is travelling.
     */
    public boolean isMoving() {
        return moving;
    }

    @JsonCreator
    public static ActivityType fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ActivityType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
