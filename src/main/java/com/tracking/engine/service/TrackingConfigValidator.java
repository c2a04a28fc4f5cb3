package com.tracking.engine.service;

import com.tracking.engine.config.TrackingConfig;
import com.tracking.engine.exception.ConfigInvalidException;
import com.tracking.engine.schedule.ScheduleWindows;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Validates configuration snapshots before a session accepts them.
 *
 * Bean Validation covers the annotated fields; the checks below cover what
 * annotations cannot express (durations, URL syntax, schedule entries,
 * backoff ordering). All violations are collected before failing.
 */
@Component
@RequiredArgsConstructor
public class TrackingConfigValidator {

    private final Validator validator;

    /**
     * @return the same config when valid
     * @throws ConfigInvalidException listing every violation
     */
    public TrackingConfig validate(TrackingConfig config) {
        if (config == null) {
            throw new ConfigInvalidException(List.of("configuration is required"));
        }
        List<String> violations = new ArrayList<>();

        validator.validate(config).stream()
            .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
            .map(TrackingConfigValidator::describe)
            .forEach(violations::add);

        requireNonNegative(violations, "motion.stopTimeout", config.motion().stopTimeout());
        requireNonNegative(violations, "motion.motionTriggerDelay", config.motion().motionTriggerDelay());
        requireNonNegative(violations, "geofence.dwellDelay", config.geofence().dwellDelay());
        requireNonNegative(violations, "schedule.heartbeatInterval", config.schedule().heartbeatInterval());
        requireNonNegative(violations, "sync.syncInterval", config.sync().syncInterval());
        requirePositive(violations, "sync.timeout", config.sync().timeout());
        requirePositive(violations, "sync.initialBackoff", config.sync().initialBackoff());

        if (config.sync().backoffCeiling().compareTo(config.sync().initialBackoff()) < 0) {
            violations.add("sync.backoffCeiling: must not be shorter than initialBackoff");
        }
        if (config.sync().enabled()) {
            validateUrl(violations, config.sync().url());
        }

        try {
            ScheduleWindows.parse(config.schedule().schedule());
        } catch (IllegalArgumentException e) {
            violations.add("schedule.schedule: " + e.getMessage());
        }

        if (!violations.isEmpty()) {
            throw new ConfigInvalidException(violations);
        }
        return config;
    }

    private static String describe(ConstraintViolation<TrackingConfig> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }

    private static void requireNonNegative(List<String> violations, String field, Duration value) {
        if (value.isNegative()) {
            violations.add(field + ": must not be negative");
        }
    }

    private static void requirePositive(List<String> violations, String field, Duration value) {
        if (value.isNegative() || value.isZero()) {
            violations.add(field + ": must be positive");
        }
    }

    private static void validateUrl(List<String> violations, String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                violations.add("sync.url: must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            violations.add("sync.url: " + e.getMessage());
        }
    }
}
