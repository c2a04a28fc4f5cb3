package com.tracking.engine.exception;

/**
 * Upload failure raised by a {@code NetworkTransport}. The kind tells the sync
 * pipeline whether the batch may be retried.
 */
public class SyncException extends TrackingException {

    public SyncException(TrackingErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        if (kind != TrackingErrorKind.SYNC_RETRYABLE
                && kind != TrackingErrorKind.SYNC_TERMINAL
                && kind != TrackingErrorKind.TIMEOUT) {
            throw new IllegalArgumentException("Not a sync error kind: " + kind);
        }
    }

    public boolean isRetryable() {
        return getKind() != TrackingErrorKind.SYNC_TERMINAL;
    }
}
