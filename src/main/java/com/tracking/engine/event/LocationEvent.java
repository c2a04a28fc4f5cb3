package com.tracking.engine.event;

import com.tracking.engine.dto.LocationSample;

import java.util.Map;

/**
 * An accepted fix as published to listeners.
 *
 * @param recordId id of the stored record, null when the persist mode skipped it
 * @param uuid     stable identifier of the fix, also present in the stored body
 * @param location the (possibly adjusted) fix
 * @param moving   declared motion state when the fix was processed
 * @param odometer odometer after the fix, meters
 * @param activity last classified activity, optional
 * @param event    "motionchange" for fixes published with a motion change, otherwise null
 * @param extras   configured extras merged into the record
 */
public record LocationEvent(
    Long recordId,
    String uuid,
    LocationSample location,
    boolean moving,
    double odometer,
    String activity,
    String event,
    Map<String, Object> extras
) {
}
