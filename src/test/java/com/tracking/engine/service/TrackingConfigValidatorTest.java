package com.tracking.engine.service;

import com.tracking.engine.config.ElasticityConfig;
import com.tracking.engine.config.MotionConfig;
import com.tracking.engine.config.ScheduleConfig;
import com.tracking.engine.config.SyncConfig;
import com.tracking.engine.config.TrackingConfig;
import com.tracking.engine.exception.ConfigInvalidException;
import com.tracking.engine.exception.TrackingErrorKind;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TrackingConfigValidatorTest {

    private ValidatorFactory factory;
    private TrackingConfigValidator configValidator;

    @BeforeEach
    void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        configValidator = new TrackingConfigValidator(factory.getValidator());
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void shouldAcceptDefaults() {
        TrackingConfig config = TrackingConfig.defaults();

        assertThat(configValidator.validate(config)).isSameAs(config);
    }

    @Test
    void shouldReportEveryViolation() {
        TrackingConfig config = TrackingConfig.builder()
            .elasticity(ElasticityConfig.builder().distanceFilter(-1.0).build())
            .sync(SyncConfig.builder().url("ftp://uploads.example.com/in").maxBatchSize(0).build())
            .motion(MotionConfig.builder().stopTimeout(Duration.ofSeconds(-1)).build())
            .schedule(ScheduleConfig.builder().schedule(List.of("1-5 17:00-09:00")).build())
            .build();

        ConfigInvalidException ex = catchThrowableOfType(
            () -> configValidator.validate(config), ConfigInvalidException.class);

        assertThat(ex.getKind()).isEqualTo(TrackingErrorKind.CONFIG_INVALID);
        assertThat(ex.getViolations()).contains(
            "elasticity.distanceFilter: distanceFilter must be >= 0",
            "sync.maxBatchSize: maxBatchSize must be >= 1",
            "motion.stopTimeout: must not be negative",
            "sync.url: must be an absolute http(s) URL");
        assertThat(ex.getViolations()).anySatisfy(v -> assertThat(v).startsWith("schedule.schedule:"));
        assertThat(ex.getViolations()).hasSize(5);
    }

    @Test
    void shouldRejectBackoffCeilingBelowInitialBackoff() {
        TrackingConfig config = TrackingConfig.builder()
            .sync(SyncConfig.builder()
                .initialBackoff(Duration.ofMinutes(2))
                .backoffCeiling(Duration.ofMinutes(1))
                .build())
            .build();

        assertThatThrownBy(() -> configValidator.validate(config))
            .isInstanceOf(ConfigInvalidException.class)
            .hasMessageContaining("sync.backoffCeiling");
    }

    @Test
    void shouldRejectMissingConfig() {
        assertThatThrownBy(() -> configValidator.validate(null))
            .isInstanceOf(ConfigInvalidException.class);
    }
}
