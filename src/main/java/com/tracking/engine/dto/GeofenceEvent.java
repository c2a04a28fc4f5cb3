package com.tracking.engine.dto;

import com.tracking.engine.geofence.GeofenceAction;

import java.time.Instant;
import java.util.Map;

/**
 * A membership edge crossed by the device for one region.
 *
 * @param identifier region id
 * @param action     ENTER, DWELL or EXIT
 * @param location   the fix that caused (or was current at) the transition, may be null for native events
 * @param extras     the region's metadata
 * @param timestamp  when the transition was detected
 */
public record GeofenceEvent(
    String identifier,
    GeofenceAction action,
    LocationSample location,
    Map<String, Object> extras,
    Instant timestamp
) {

    public String toLogString() {
        return String.format("GeofenceEvent[%s %s at %s]", action, identifier, timestamp);
    }
}
