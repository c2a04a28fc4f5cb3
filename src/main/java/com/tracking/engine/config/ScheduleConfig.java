package com.tracking.engine.config;

import lombok.Builder;

import java.time.Duration;
import java.util.List;

/**
 * Time windows and session-wide timers.
 *
 * @param schedule                entries such as {@code "1-5 09:00-17:00"} (ISO weekdays, 1 = Monday)
 * @param stopAfterElapsedMinutes stop tracking after this many minutes, 0 or less disables
 * @param heartbeatInterval       period of heartbeat events, zero disables them
 */
@Builder(toBuilder = true)
public record ScheduleConfig(
    List<String> schedule,
    Integer stopAfterElapsedMinutes,
    Duration heartbeatInterval
) {

    public ScheduleConfig {
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
        if (stopAfterElapsedMinutes == null) {
            stopAfterElapsedMinutes = 0;
        }
        if (heartbeatInterval == null) {
            heartbeatInterval = Duration.ZERO;
        }
    }

    public static ScheduleConfig defaults() {
        return ScheduleConfig.builder().build();
    }

    public boolean scheduled() {
        return !schedule.isEmpty();
    }

    public boolean autoStopEnabled() {
        return stopAfterElapsedMinutes > 0;
    }

    public boolean heartbeatEnabled() {
        return !heartbeatInterval.isZero() && !heartbeatInterval.isNegative();
    }
}
