package com.tracking.engine.bridge;

import java.time.Instant;
import java.util.Map;

/**
 * Command published to the device on {@code /topic/device/commands}.
 *
 * @param type    command name, e.g. {@code location.start}, {@code geofence.register}
 * @param payload command arguments
 * @param issued  when the engine issued it
 */
public record DeviceCommand(String type, Map<String, Object> payload, Instant issued) {

    public static DeviceCommand of(String type, Map<String, Object> payload) {
        return new DeviceCommand(type, payload, Instant.now());
    }

    public static DeviceCommand of(String type) {
        return of(type, Map.of());
    }
}
