package com.tracking.engine.platform;

/**
 * Command side of the activity classifier and accelerometer. Every call is
 * idempotent on the device side.
 */
public interface MotionSensors {

    void startActivityUpdates();

    void stopActivityUpdates();

    void enableAccelerometer();

    void disableAccelerometer();
}
