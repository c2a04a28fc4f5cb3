package com.tracking.engine.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

/**
 * Replaces wall-clock time and real timers so tests drive them explicitly.
 */
@TestConfiguration
public class TrackingTestConfig {

    public static final Instant START = Instant.parse("2024-01-01T12:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START);
    }

    @Bean
    @Primary
    public ManualTimerService manualTimerService(MutableClock testClock) {
        return new ManualTimerService(testClock);
    }
}
