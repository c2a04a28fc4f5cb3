package com.tracking.engine.event;

import com.tracking.engine.dto.LocationSample;

/**
 * @param moving   the newly declared state
 * @param location last accepted fix, null before the first one
 */
public record MotionChangeEvent(boolean moving, LocationSample location) {
}
