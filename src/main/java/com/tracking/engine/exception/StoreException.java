package com.tracking.engine.exception;

public class StoreException extends TrackingException {

    public StoreException(String message, Throwable cause) {
        super(TrackingErrorKind.STORE_ERROR, message, cause);
    }

    public StoreException(TrackingErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
