package com.tracking.engine.bridge;

import com.tracking.engine.dto.GeofenceRegion;
import com.tracking.engine.event.TrackingError;
import com.tracking.engine.event.TrackingEventBus;
import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.platform.LocationProvider;
import com.tracking.engine.platform.MotionSensors;
import com.tracking.engine.platform.NativeGeofenceService;
import com.tracking.engine.platform.ProviderMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device-side ports implemented as STOMP commands.
 *
 * Every command goes to {@value #COMMAND_TOPIC}; the device bridge executes it
 * against the platform location, sensor and geofencing APIs. A command the
 * broker refuses is reported as a {@code PROVIDER_UNAVAILABLE} error event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceCommandGateway implements LocationProvider, MotionSensors, NativeGeofenceService {

    public static final String COMMAND_TOPIC = "/topic/device/commands";

    private final SimpMessagingTemplate messagingTemplate;
    private final TrackingEventBus events;

    @Override
    public void start(ProviderMode mode, double minDistanceMeters) {
        send(DeviceCommand.of("location.start", Map.of(
                "mode", mode.name(),
                "distanceFilter", minDistanceMeters
        )));
    }

    @Override
    public void setMinimumDistance(double minDistanceMeters) {
        send(DeviceCommand.of("location.distanceFilter", Map.of("distanceFilter", minDistanceMeters)));
    }

    @Override
    public void stop() {
        send(DeviceCommand.of("location.stop"));
    }

    @Override
    public void startActivityUpdates() {
        send(DeviceCommand.of("activity.start"));
    }

    @Override
    public void stopActivityUpdates() {
        send(DeviceCommand.of("activity.stop"));
    }

    @Override
    public void enableAccelerometer() {
        send(DeviceCommand.of("accelerometer.start"));
    }

    @Override
    public void disableAccelerometer() {
        send(DeviceCommand.of("accelerometer.stop"));
    }

    @Override
    public void register(GeofenceRegion region) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("identifier", region.identifier());
        payload.put("latitude", region.latitude());
        payload.put("longitude", region.longitude());
        payload.put("radius", region.radius());
        payload.put("notifyOnEntry", region.notifyOnEntry());
        payload.put("notifyOnExit", region.notifyOnExit());
        payload.put("notifyOnDwell", region.notifyOnDwell());
        payload.put("loiteringDelay", region.loiteringDelay());
        if (region.polygonal()) {
            payload.put("vertices", region.vertices());
        }
        send(DeviceCommand.of("geofence.register", payload));
    }

    @Override
    public void unregister(String identifier) {
        send(DeviceCommand.of("geofence.unregister", Map.of("identifier", identifier)));
    }

    @Override
    public void unregisterAll() {
        send(DeviceCommand.of("geofence.unregisterAll"));
    }

    private void send(DeviceCommand command) {
        try {
            messagingTemplate.convertAndSend(COMMAND_TOPIC, command);
            log.debug("Device command sent: {} {}", command.type(), command.payload());
        } catch (MessagingException e) {
            log.error("Failed to send device command {}: {}", command.type(), e.getMessage(), e);
            events.publishError(TrackingError.of(TrackingErrorKind.PROVIDER_UNAVAILABLE,
                    "Device command " + command.type() + " not delivered: " + e.getMessage()));
        }
    }
}
