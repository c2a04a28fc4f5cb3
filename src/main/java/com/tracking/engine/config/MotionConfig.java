package com.tracking.engine.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.time.Duration;

/**
 * Motion detection timing.
 *
 * @param stopTimeout                  time spent STILL before STATIONARY is declared
 * @param motionTriggerDelay           delay before MOVING is declared after motion resumes
 * @param shakeThreshold               accelerometer magnitude above gravity that counts as motion, m/s²
 * @param disableMotionActivityUpdates do not start the activity classifier
 * @param initiallyMoving              state declared when tracking starts
 */
@Builder(toBuilder = true)
public record MotionConfig(
    Duration stopTimeout,
    Duration motionTriggerDelay,
    @PositiveOrZero(message = "shakeThreshold must be >= 0") Double shakeThreshold,
    Boolean disableMotionActivityUpdates,
    Boolean initiallyMoving
) {

    public static final double DEFAULT_SHAKE_THRESHOLD = 2.5;

    public MotionConfig {
        if (stopTimeout == null) {
            stopTimeout = Duration.ofMinutes(5);
        }
        if (motionTriggerDelay == null) {
            motionTriggerDelay = Duration.ZERO;
        }
        if (shakeThreshold == null) {
            shakeThreshold = DEFAULT_SHAKE_THRESHOLD;
        }
        if (disableMotionActivityUpdates == null) {
            disableMotionActivityUpdates = Boolean.FALSE;
        }
        if (initiallyMoving == null) {
            initiallyMoving = Boolean.FALSE;
        }
    }

    public static MotionConfig defaults() {
        return MotionConfig.builder().build();
    }
}
