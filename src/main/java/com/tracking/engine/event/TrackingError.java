package com.tracking.engine.event;

import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.exception.TrackingException;

import java.time.Instant;

/**
 * Error event. Every failure the engine observes ends up as one of these.
 */
public record TrackingError(TrackingErrorKind kind, String message, Instant timestamp) {

    public static TrackingError of(TrackingErrorKind kind, String message) {
        return new TrackingError(kind, message, Instant.now());
    }

    public static TrackingError from(TrackingException e) {
        return new TrackingError(e.getKind(), e.getMessage(), Instant.now());
    }
}
