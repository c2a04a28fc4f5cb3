package com.tracking.engine.platform;

/**
 * Command side of the device location provider.
 */
public interface LocationProvider {

    /**
     * Starts (or switches) location updates.
     *
     * @param mode               power mode
     * @param minDistanceMeters  minimum displacement between delivered fixes
     */
    void start(ProviderMode mode, double minDistanceMeters);

    /**
     * Updates the minimum displacement without changing the mode.
     */
    void setMinimumDistance(double minDistanceMeters);

    void stop();
}
