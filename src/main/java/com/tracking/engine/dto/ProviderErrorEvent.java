package com.tracking.engine.dto;

import jakarta.validation.constraints.NotNull;

/**
 * A device-side source reported that it is gone or refused to start.
 */
public record ProviderErrorEvent(
    @NotNull Source source,
    String detail
) {

    public enum Source {
        LOCATION,
        ACTIVITY,
        ACCELEROMETER
    }
}
