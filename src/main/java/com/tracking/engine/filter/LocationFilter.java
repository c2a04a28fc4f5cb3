package com.tracking.engine.filter;

import com.tracking.engine.config.FilterConfig;
import com.tracking.engine.dto.LocationSample;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Validates incoming fixes against the last accepted one.
 *
 * Checks, in order:
 * 1. Accuracy: {@code accuracy > trackingAccuracyThreshold} fails
 * 2. Implied speed: distance / elapsed time since the last accepted fix
 *    above {@code maxImpliedSpeed} fails
 * 3. Odometer accuracy: {@code accuracy > odometerAccuracyThreshold} keeps the
 *    fix but excludes it from odometer accumulation
 *
 * A failed check 1 or 2 applies the configured {@link com.tracking.engine.config.FilterPolicy}.
 * ADJUST needs a previous accepted fix to copy from; without one the fix is dropped silently.
 *
 * Not thread-safe. One instance per session, driven from the session thread.
 */
@Slf4j
public class LocationFilter {

    private final FilterConfig config;
    private final Map<FilterResult.Rejection, Long> rejectionCounts = new EnumMap<>(FilterResult.Rejection.class);

    private LocationSample lastAccepted;
    private LocationSample lastOdometerFix;

    public LocationFilter(FilterConfig config) {
        this.config = config;
    }

    public FilterResult process(LocationSample sample) {
        if (config.accuracyCheckEnabled()
                && sample.accuracy() != null
                && sample.accuracy() > config.trackingAccuracyThreshold()) {
            return applyPolicy(sample, FilterResult.Rejection.ACCURACY, String.format(
                "accuracy %.1fm exceeds %.1fm", sample.accuracy(), config.trackingAccuracyThreshold()));
        }

        if (config.speedCheckEnabled() && lastAccepted != null) {
            long elapsedMillis = sample.elapsedSince(lastAccepted).toMillis();
            if (elapsedMillis > 0) {
                double impliedSpeed = sample.distanceTo(lastAccepted) / (elapsedMillis / 1000.0);
                if (impliedSpeed > config.maxImpliedSpeed()) {
                    return applyPolicy(sample, FilterResult.Rejection.IMPLIED_SPEED, String.format(
                        "implied speed %.1fm/s exceeds %.1fm/s", impliedSpeed, config.maxImpliedSpeed()));
                }
            }
        }

        return FilterResult.accepted(sample, acceptForOdometer(sample));
    }

    private FilterResult applyPolicy(LocationSample sample, FilterResult.Rejection rejection, String detail) {
        rejectionCounts.merge(rejection, 1L, Long::sum);

        switch (config.policy()) {
            case DISCARD:
                log.debug("Discarding {}: {}", sample.toLogString(), detail);
                return FilterResult.rejected(rejection, true, detail);
            case IGNORE:
                log.debug("Ignoring {}: {}", sample.toLogString(), detail);
                return FilterResult.rejected(rejection, false, detail);
            case ADJUST:
            default:
                if (lastAccepted == null) {
                    log.debug("Cannot adjust {} without a previous fix: {}", sample.toLogString(), detail);
                    return FilterResult.rejected(rejection, false, detail);
                }
                LocationSample adjusted = sample.withGeometryOf(lastAccepted);
                lastAccepted = adjusted;
                log.debug("Adjusted {} to last accepted geometry: {}", sample.toLogString(), detail);
                return FilterResult.adjusted(adjusted, rejection, detail);
        }
    }

    /**
     * Records {@code sample} as the last accepted fix and returns its odometer contribution.
     */
    private double acceptForOdometer(LocationSample sample) {
        lastAccepted = sample;

        boolean eligible = !config.odometerCheckEnabled()
            || sample.accuracy() == null
            || sample.accuracy() <= config.odometerAccuracyThreshold();
        if (!eligible) {
            return 0.0;
        }

        double delta = lastOdometerFix == null ? 0.0 : sample.distanceTo(lastOdometerFix);
        lastOdometerFix = sample;
        return delta;
    }

    public LocationSample lastAccepted() {
        return lastAccepted;
    }

    public Map<FilterResult.Rejection, Long> rejectionCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(rejectionCounts));
    }

    public long totalRejections() {
        return rejectionCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
