package com.tracking.engine.platform;

/**
 * Location authorization precondition. Granting permission is the host app's concern.
 */
public interface PermissionChecker {

    boolean locationPermitted();
}
