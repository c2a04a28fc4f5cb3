package com.tracking.engine.filter;

import com.tracking.engine.dto.LocationSample;

/**
 * Outcome of running one fix through the {@link LocationFilter}.
 *
 * @param decision      accepted as-is, accepted with substituted geometry, or dropped
 * @param sample        the fix to route downstream, null when rejected
 * @param rejection     which check failed, null when the fix passed every check
 * @param publishError  true when exactly one FILTER_REJECTED error must be published
 * @param odometerDelta meters to add to the odometer while moving
 * @param detail        human readable reason for logs and error events
 */
public record FilterResult(
    Decision decision,
    LocationSample sample,
    Rejection rejection,
    boolean publishError,
    double odometerDelta,
    String detail
) {

    public enum Decision {
        ACCEPTED,
        ADJUSTED,
        REJECTED
    }

    public enum Rejection {
        ACCURACY,
        IMPLIED_SPEED
    }

    static FilterResult accepted(LocationSample sample, double odometerDelta) {
        return new FilterResult(Decision.ACCEPTED, sample, null, false, odometerDelta, null);
    }

    static FilterResult adjusted(LocationSample sample, Rejection rejection, String detail) {
        return new FilterResult(Decision.ADJUSTED, sample, rejection, false, 0.0, detail);
    }

    static FilterResult rejected(Rejection rejection, boolean publishError, String detail) {
        return new FilterResult(Decision.REJECTED, null, rejection, publishError, 0.0, detail);
    }

    public boolean accepted() {
        return decision != Decision.REJECTED;
    }
}
