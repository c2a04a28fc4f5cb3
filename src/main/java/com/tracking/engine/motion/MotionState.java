package com.tracking.engine.motion;

/**
 * Motion classification of the device.
 *
 * PENDING_STOP is still a moving state from the outside: the stop-timeout
 * timer is armed but STATIONARY has not been declared yet.
 */
public enum MotionState {
    MOVING,
    STATIONARY,
    PENDING_STOP;

    public boolean declaredMoving() {
        return this != STATIONARY;
    }
}
