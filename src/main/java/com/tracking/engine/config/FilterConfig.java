package com.tracking.engine.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * Location filter thresholds. A threshold of 0 disables that check.
 *
 * @param policy                    action taken when a fix fails a check
 * @param trackingAccuracyThreshold maximum accepted horizontal accuracy in meters
 * @param maxImpliedSpeed           maximum speed implied by two consecutive accepted fixes, m/s
 * @param odometerAccuracyThreshold maximum accuracy for a fix to count towards the odometer, meters
 */
@Builder(toBuilder = true)
public record FilterConfig(
    @NotNull FilterPolicy policy,
    @PositiveOrZero(message = "trackingAccuracyThreshold must be >= 0") Double trackingAccuracyThreshold,
    @PositiveOrZero(message = "maxImpliedSpeed must be >= 0") Double maxImpliedSpeed,
    @PositiveOrZero(message = "odometerAccuracyThreshold must be >= 0") Double odometerAccuracyThreshold
) {

    public FilterConfig {
        if (policy == null) {
            policy = FilterPolicy.ADJUST;
        }
        if (trackingAccuracyThreshold == null) {
            trackingAccuracyThreshold = 0.0;
        }
        if (maxImpliedSpeed == null) {
            maxImpliedSpeed = 0.0;
        }
        if (odometerAccuracyThreshold == null) {
            odometerAccuracyThreshold = 0.0;
        }
    }

    public static FilterConfig defaults() {
        return FilterConfig.builder().build();
    }

    public boolean accuracyCheckEnabled() {
        return trackingAccuracyThreshold > 0;
    }

    public boolean speedCheckEnabled() {
        return maxImpliedSpeed > 0;
    }

    public boolean odometerCheckEnabled() {
        return odometerAccuracyThreshold > 0;
    }
}
