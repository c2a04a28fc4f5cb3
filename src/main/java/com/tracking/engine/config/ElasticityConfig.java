package com.tracking.engine.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * Speed-scaled minimum distance between fixes.
 *
 * @param distanceFilter       base minimum distance in meters
 * @param elasticityMultiplier how strongly speed stretches the distance filter
 * @param disableElasticity    use {@code distanceFilter} unscaled
 */
@Builder(toBuilder = true)
public record ElasticityConfig(
    @PositiveOrZero(message = "distanceFilter must be >= 0") Double distanceFilter,
    @PositiveOrZero(message = "elasticityMultiplier must be >= 0") Double elasticityMultiplier,
    Boolean disableElasticity
) {

    public static final double DEFAULT_DISTANCE_FILTER = 10.0;

    public ElasticityConfig {
        if (distanceFilter == null) {
            distanceFilter = DEFAULT_DISTANCE_FILTER;
        }
        if (elasticityMultiplier == null) {
            elasticityMultiplier = 1.0;
        }
        if (disableElasticity == null) {
            disableElasticity = Boolean.FALSE;
        }
    }

    public static ElasticityConfig defaults() {
        return ElasticityConfig.builder().build();
    }
}
