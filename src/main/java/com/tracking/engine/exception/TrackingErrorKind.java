package com.tracking.engine.exception;

/**
 * Error taxonomy shared by exceptions thrown to callers and by error events
 * published to listeners.
 *
 * Only {@link #CONFIG_INVALID} and {@link #PERMISSION_DENIED} prevent a session
 * from entering TRACKING. Everything else is scoped to a single fix, record or
 * batch and is reported without aborting the session.
 */
public enum TrackingErrorKind {

    /** A configuration snapshot failed validation. */
    CONFIG_INVALID,

    /** Location, activity or accelerometer source lost or refused. */
    PROVIDER_UNAVAILABLE,

    /** Location authorization missing. */
    PERMISSION_DENIED,

    /** A fix was dropped by the location filter under the DISCARD policy. */
    FILTER_REJECTED,

    /** Persistence failed for one record or one retention pass. */
    STORE_ERROR,

    /** Upload failed in a way that is worth retrying (network, 5xx). */
    SYNC_RETRYABLE,

    /** Upload rejected by the server (4xx); the batch is not retried. */
    SYNC_TERMINAL,

    /** A bounded wait expired. */
    TIMEOUT
}
