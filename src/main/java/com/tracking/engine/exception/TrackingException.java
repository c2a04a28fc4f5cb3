package com.tracking.engine.exception;

import lombok.Getter;

/**
 * Base class of every error the engine raises, tagged with its {@link TrackingErrorKind}.
 */
@Getter
public class TrackingException extends RuntimeException {

    private final TrackingErrorKind kind;

    public TrackingException(TrackingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TrackingException(TrackingErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
