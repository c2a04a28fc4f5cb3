package com.tracking.engine.dto;

import com.tracking.engine.geo.GeoMath;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable location fix as delivered by the device location provider.
 *
 * Only latitude, longitude and timestamp are mandatory. Accuracy, speed and
 * heading are optional and treated as unknown when null.
 *
 * @param latitude  WGS84 latitude in decimal degrees
 * @param longitude WGS84 longitude in decimal degrees
 * @param altitude  altitude in meters, optional
 * @param accuracy  horizontal accuracy radius in meters, optional
 * @param speed     ground speed in m/s, optional
 * @param heading   course in degrees (0-360, 0 is North), optional
 * @param timestamp when the fix was captured on the device
 * @param provider  provider tag (gps, network, fused, ...), optional
 */
@Builder(toBuilder = true)
public record LocationSample(
    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    Double altitude,

    @PositiveOrZero(message = "Accuracy must be >= 0")
    Double accuracy,

    Double speed,

    Double heading,

    @NotNull(message = "Timestamp is required")
    Instant timestamp,

    String provider
) {

    public LocationSample {
        if (heading != null && (heading >= 360 || heading < 0)) {
            heading = ((heading % 360) + 360) % 360;
        }
    }

    /**
     * Great-circle distance to another fix in meters.
     */
    public double distanceTo(LocationSample other) {
        return GeoMath.distanceMeters(latitude, longitude, other.latitude, other.longitude);
    }

    /**
     * Distance in meters to an arbitrary coordinate.
     */
    public double distanceTo(double lat, double lon) {
        return GeoMath.distanceMeters(latitude, longitude, lat, lon);
    }

    /**
     * Time elapsed since an earlier fix. Negative when {@code earlier} is actually later.
     */
    public Duration elapsedSince(LocationSample earlier) {
        return Duration.between(earlier.timestamp, timestamp);
    }

    /**
     * Copy of {@code source}'s geometry (position, accuracy, motion vector)
     * stamped with this fix's time and provider.
     */
    public LocationSample withGeometryOf(LocationSample source) {
        return new LocationSample(
            source.latitude,
            source.longitude,
            source.altitude,
            source.accuracy,
            source.speed,
            source.heading,
            timestamp,
            provider
        );
    }

    public double speedOrZero() {
        return speed == null || speed < 0 ? 0.0 : speed;
    }

    public String toLogString() {
        return String.format(
            "Fix[lat=%.6f, lon=%.6f, acc=%s, speed=%s, time=%s]",
            latitude, longitude, accuracy, speed, timestamp
        );
    }
}
