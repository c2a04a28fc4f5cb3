package com.tracking.engine.dto;

/**
 * Raw accelerometer reading in m/s², gravity included.
 */
public record AccelerometerSample(double x, double y, double z) {

    /** Standard gravity as used by the shake detector. */
    public static final double GRAVITY = 9.81;

    /**
     * Vector magnitude minus gravity. A device at rest reads close to zero.
     */
    public double magnitudeAboveGravity() {
        return Math.sqrt(x * x + y * y + z * z) - GRAVITY;
    }
}
