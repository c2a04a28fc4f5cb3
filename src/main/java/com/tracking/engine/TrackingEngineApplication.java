package com.tracking.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Tracking Engine.
 *
 * Annotations:
 * - @EnableCaching: geofence definition lookups (Redis)
 * - @EnableAsync: background retention pruning after inserts
 * - @EnableScheduling: periodic retention sweep
 *
 * Flow:
 * 1. Device output (fixes, activity, accelerometer, connectivity) arrives via STOMP
 * 2. The session filters fixes, tracks motion and evaluates geofences
 * 3. Accepted fixes and geofence transitions are persisted under retention limits
 * 4. Events are broadcast on /topic/* and unsynced records are uploaded over HTTP
 * 5. Provider and sensor commands go back to the device on /topic/device/commands
 */
@SpringBootApplication
@EnableCaching
@EnableAsync
@EnableScheduling
public class TrackingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackingEngineApplication.class, args);
    }
}
