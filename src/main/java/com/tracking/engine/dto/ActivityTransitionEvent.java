package com.tracking.engine.dto;

import com.tracking.engine.motion.ActivityType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Activity classifier output: the device entered or exited an activity.
 *
 * @param activity   classified activity
 * @param entering   true on ENTER, false on EXIT
 * @param confidence classifier confidence 0-100, optional
 * @param timestamp  classification time
 */
public record ActivityTransitionEvent(
    @NotNull(message = "Activity is required")
    ActivityType activity,

    boolean entering,

    @Min(0) @Max(100)
    Integer confidence,

    Instant timestamp
) {

    public static ActivityTransitionEvent enter(ActivityType activity) {
        return new ActivityTransitionEvent(activity, true, 100, Instant.now());
    }

    public static ActivityTransitionEvent exit(ActivityType activity) {
        return new ActivityTransitionEvent(activity, false, 100, Instant.now());
    }
}
