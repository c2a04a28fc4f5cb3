package com.tracking.engine.controller;

import com.tracking.engine.bridge.DeviceStatusRegistry;
import com.tracking.engine.dto.AccelerometerSample;
import com.tracking.engine.dto.ActivityTransitionEvent;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.NativeGeofenceEvent;
import com.tracking.engine.dto.ProviderErrorEvent;
import com.tracking.engine.platform.TransportType;
import com.tracking.engine.service.TrackingSessionService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * STOMP inbound side of the device bridge.
 *
 * Message Flow:
 * 1. The device sends raw platform output to /app/device/*
 * 2. The controller hands it to the session, which queues it in arrival order
 * 3. Session output is broadcast on /topic/* by the event forwarder
 * 4. Failures, including fixes that fail validation, are reported privately
 *    via /user/queue/errors
 *
 * Usage:
 * - Connect to: ws://localhost:8080/ws/tracking
 * - Send to: /app/device/location, /app/device/activity, /app/device/accelerometer,
 *   /app/device/geofence, /app/device/connectivity, /app/device/provider-error,
 *   /app/device/authorization
 * - Subscribe to: /topic/device/commands for provider and sensor commands
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class DeviceStreamController {

    private final TrackingSessionService sessionService;
    private final DeviceStatusRegistry deviceStatus;
    private final SimpMessagingTemplate messagingTemplate;
    private final Validator validator;

    @MessageMapping("/device/location")
    public void handleLocation(@Payload @Valid LocationSample sample, Principal principal) {
        submitLocation(sample, principal);
    }

    /**
     * Several fixes buffered by the device, processed in list order. Invalid
     * fixes are reported and skipped, the rest still go through.
     */
    @MessageMapping("/device/location/batch")
    public void handleLocationBatch(@Payload List<LocationSample> samples, Principal principal) {
        log.info("Received batch of {} fixes", samples.size());
        for (LocationSample sample : samples) {
            Set<ConstraintViolation<LocationSample>> violations = validator.validate(sample);
            if (violations.isEmpty()) {
                submitLocation(sample, principal);
            } else {
                String detail = violations.stream()
                        .map(ConstraintViolation::getMessage)
                        .sorted()
                        .collect(Collectors.joining(", "));
                reportFailure("location", new IllegalArgumentException("Invalid fix: " + detail), principal);
            }
        }
    }

    private void submitLocation(LocationSample sample, Principal principal) {
        log.debug("Received fix: {}", sample.toLogString());
        sessionService.onLocation(sample)
                .whenComplete((ignored, error) -> reportFailure("location", error, principal));
    }

    @MessageMapping("/device/activity")
    public void handleActivity(@Payload ActivityTransitionEvent event, Principal principal) {
        log.debug("Activity transition: {} {}", event.entering() ? "enter" : "exit", event.activity());
        sessionService.onActivity(event)
                .whenComplete((ignored, error) -> reportFailure("activity", error, principal));
    }

    @MessageMapping("/device/accelerometer")
    public void handleAccelerometer(@Payload AccelerometerSample sample, Principal principal) {
        sessionService.onAccelerometer(sample)
                .whenComplete((ignored, error) -> reportFailure("accelerometer", error, principal));
    }

    @MessageMapping("/device/geofence")
    public void handleNativeGeofence(@Payload NativeGeofenceEvent event, Principal principal) {
        log.debug("Native geofence event: {} {}", event.action(), event.identifier());
        sessionService.onNativeGeofence(event)
                .whenComplete((ignored, error) -> reportFailure("geofence", error, principal));
    }

    @MessageMapping("/device/connectivity")
    public void handleConnectivity(@Payload Map<String, String> payload, Principal principal) {
        TransportType current = parseTransport(payload.get("transport"));
        TransportType previous = deviceStatus.updateTransport(current);
        sessionService.onConnectivityChange(previous, current)
                .whenComplete((ignored, error) -> reportFailure("connectivity", error, principal));
    }

    @MessageMapping("/device/provider-error")
    public void handleProviderError(@Payload ProviderErrorEvent event, Principal principal) {
        log.warn("Device reported {} failure: {}", event.source(), event.detail());
        sessionService.onProviderError(event)
                .whenComplete((ignored, error) -> reportFailure("provider-error", error, principal));
    }

    @MessageMapping("/device/authorization")
    public void handleAuthorization(@Payload Map<String, Boolean> payload, Principal principal) {
        boolean granted = Boolean.TRUE.equals(payload.get("granted"));
        deviceStatus.updateAuthorization(granted);
        sessionService.onAuthorizationChange(granted)
                .whenComplete((ignored, error) -> reportFailure("authorization", error, principal));
    }

    /**
     * Health check for the device connection.
     */
    @MessageMapping("/device/ping")
    @SendToUser("/queue/reply")
    public Map<String, Object> handlePing(Principal principal) {
        log.debug("Ping received from {}", principal != null ? principal.getName() : "anonymous");
        return Map.of(
                "type", "PONG",
                "serverTime", Instant.now().toString(),
                "status", "OK"
        );
    }

    /**
     * Unknown or missing transport names count as offline.
     */
    static TransportType parseTransport(String value) {
        if (value == null || value.isBlank()) {
            return TransportType.NONE;
        }
        try {
            return TransportType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown transport '{}' reported, treating as {}", value, TransportType.NONE);
            return TransportType.NONE;
        }
    }

    @MessageExceptionHandler(MethodArgumentNotValidException.class)
    public void handleInvalidPayload(MethodArgumentNotValidException e, Principal principal) {
        reportFailure("location", e, principal);
    }

    private void reportFailure(String stream, Throwable error, Principal principal) {
        if (error == null) {
            return;
        }
        log.error("Error processing {} message: {}", stream, error.getMessage());
        if (principal != null) {
            messagingTemplate.convertAndSendToUser(
                    principal.getName(),
                    "/queue/errors",
                    Map.of(
                            "status", "ERROR",
                            "stream", stream,
                            "error", String.valueOf(error.getMessage()),
                            "timestamp", Instant.now().toString()
                    )
            );
        }
    }
}
