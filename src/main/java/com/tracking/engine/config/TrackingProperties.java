package com.tracking.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Infrastructure settings of the engine ({@code tracking.*} in application.yml).
 * Per-session behavior lives in {@link TrackingConfig}, not here.
 */
@Data
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    private Engine engine = new Engine();
    private Sync sync = new Sync();
    private Cache cache = new Cache();

    @Data
    public static class Engine {

        /**
         * Hard limit of regions the platform geofence monitor accepts.
         */
        private int platformGeofenceCapacity = 20;

        /**
         * Bound on session-thread waits for persistence.
         */
        private Duration storeTimeout = Duration.ofSeconds(5);

        /**
         * Bound on callers waiting for the session thread.
         */
        private Duration queryTimeout = Duration.ofSeconds(5);

        /**
         * Zone used to evaluate schedule windows.
         */
        private String zoneId = "UTC";
    }

    @Data
    public static class Sync {

        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Cache {

        private long ttlMinutes = 60;
    }
}
