package com.tracking.engine.exception;

public class PermissionDeniedException extends TrackingException {

    public PermissionDeniedException(String message) {
        super(TrackingErrorKind.PERMISSION_DENIED, message);
    }
}
