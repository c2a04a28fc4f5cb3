package com.tracking.engine.filter;

import com.tracking.engine.config.ElasticityConfig;

/**
 * Stretches the distance filter with speed so that fast travel produces
 * fewer, more widely spaced fixes.
 *
 * {@code effective = distanceFilter * (1 + elasticityMultiplier * round(speed / 5))}
 * with speed in m/s. Each 5 m/s of speed adds one multiple of the multiplier.
 */
public class ElasticityCalculator {

    static final double SPEED_STEP_MPS = 5.0;

    private final ElasticityConfig config;

    public ElasticityCalculator(ElasticityConfig config) {
        this.config = config;
    }

    /**
     * Effective minimum distance in meters for the given speed. Negative or
     * unknown speeds count as standing still.
     */
    public double effectiveDistance(double speedMps) {
        if (config.disableElasticity()) {
            return config.distanceFilter();
        }
        double speed = Double.isNaN(speedMps) || speedMps < 0 ? 0.0 : speedMps;
        long steps = Math.round(speed / SPEED_STEP_MPS);
        return config.distanceFilter() * (1 + config.elasticityMultiplier() * steps);
    }

    public double baseDistance() {
        return config.distanceFilter();
    }
}
