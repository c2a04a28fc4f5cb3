package com.tracking.engine.filter;

import com.tracking.engine.config.ElasticityConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ElasticityCalculatorTest {

    @Test
    void shouldScaleDistanceFilterWithSpeed() {
        ElasticityCalculator calculator = new ElasticityCalculator(ElasticityConfig.builder()
            .distanceFilter(10.0)
            .elasticityMultiplier(2.0)
            .build());

        // 10 * (1 + 2 * round(20 / 5)) = 90
        assertThat(calculator.effectiveDistance(20.0)).isEqualTo(90.0);
        assertThat(calculator.effectiveDistance(0.0)).isEqualTo(10.0);
        assertThat(calculator.effectiveDistance(2.4)).isEqualTo(10.0);
        assertThat(calculator.effectiveDistance(2.5)).isEqualTo(30.0);
    }

    @Test
    void shouldTreatUnknownSpeedAsStationary() {
        ElasticityCalculator calculator = new ElasticityCalculator(ElasticityConfig.defaults());

        assertThat(calculator.effectiveDistance(-1.0)).isEqualTo(10.0);
        assertThat(calculator.effectiveDistance(Double.NaN)).isEqualTo(10.0);
    }

    @Test
    void shouldUseConfiguredDistanceWhenElasticityDisabled() {
        ElasticityCalculator calculator = new ElasticityCalculator(ElasticityConfig.builder()
            .distanceFilter(10.0)
            .elasticityMultiplier(2.0)
            .disableElasticity(true)
            .build());

        assertThat(calculator.effectiveDistance(20.0)).isEqualTo(10.0);
        assertThat(calculator.baseDistance()).isEqualTo(10.0);
    }
}
