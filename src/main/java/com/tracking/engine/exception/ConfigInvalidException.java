package com.tracking.engine.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a {@code TrackingConfig} snapshot is rejected. Carries every
 * violation found, not just the first one.
 */
@Getter
public class ConfigInvalidException extends TrackingException {

    private final List<String> violations;

    public ConfigInvalidException(List<String> violations) {
        super(TrackingErrorKind.CONFIG_INVALID, "Invalid tracking configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
