package com.tracking.engine.controller;

import com.tracking.engine.bridge.DeviceStatusRegistry;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.platform.TransportType;
import com.tracking.engine.service.TrackingSessionService;
import jakarta.validation.Valid;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.lang.reflect.Parameter;
import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceStreamControllerTest {

    private static final Principal DEVICE = () -> "device-1";

    private TrackingSessionService sessionService;
    private DeviceStatusRegistry deviceStatus;
    private SimpMessagingTemplate messagingTemplate;
    private DeviceStreamController controller;

    @BeforeEach
    void setUp() {
        sessionService = mock(TrackingSessionService.class);
        deviceStatus = new DeviceStatusRegistry();
        messagingTemplate = mock(SimpMessagingTemplate.class);
        when(sessionService.onLocation(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(sessionService.onConnectivityChange(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        controller = new DeviceStreamController(sessionService, deviceStatus, messagingTemplate,
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    private static LocationSample fix(Double latitude) {
        return LocationSample.builder()
                .latitude(latitude)
                .longitude(-122.415)
                .accuracy(5.0)
                .timestamp(Instant.parse("2024-01-01T12:00:00Z"))
                .build();
    }

    @Test
    void shouldTreatUnknownTransportAsOffline() {
        deviceStatus.updateTransport(TransportType.WIFI);

        controller.handleConnectivity(Map.of("transport", "satellite"), DEVICE);

        verify(sessionService).onConnectivityChange(TransportType.WIFI, TransportType.NONE);
        assertThat(deviceStatus.updateTransport(TransportType.WIFI)).isEqualTo(TransportType.NONE);
    }

    @Test
    void shouldParseTransportNamesCaseInsensitively() {
        assertThat(DeviceStreamController.parseTransport("cellular")).isEqualTo(TransportType.CELLULAR);
        assertThat(DeviceStreamController.parseTransport(" Wifi ")).isEqualTo(TransportType.WIFI);
        assertThat(DeviceStreamController.parseTransport(null)).isEqualTo(TransportType.NONE);
        assertThat(DeviceStreamController.parseTransport("")).isEqualTo(TransportType.NONE);
    }

    @Test
    void shouldValidateSingleFixPayload() throws Exception {
        Parameter parameter = DeviceStreamController.class
                .getMethod("handleLocation", LocationSample.class, Principal.class)
                .getParameters()[0];

        assertThat(parameter.isAnnotationPresent(Valid.class)).isTrue();
    }

    @Test
    void shouldSkipAndReportInvalidFixesInBatch() {
        LocationSample valid = fix(37.78);

        controller.handleLocationBatch(List.of(valid, fix(null), fix(91.0)), DEVICE);

        verify(sessionService, times(1)).onLocation(any());
        verify(sessionService).onLocation(valid);
        verify(messagingTemplate).convertAndSendToUser(eq("device-1"), eq("/queue/errors"),
                argThat((Map<String, String> body) -> body.get("error").contains("Latitude is required")));
        verify(messagingTemplate).convertAndSendToUser(eq("device-1"), eq("/queue/errors"),
                argThat((Map<String, String> body) -> body.get("error").contains("Latitude must be <= 90")));
        verify(messagingTemplate, times(2)).convertAndSendToUser(eq("device-1"), eq("/queue/errors"), anyMap());
    }
}
