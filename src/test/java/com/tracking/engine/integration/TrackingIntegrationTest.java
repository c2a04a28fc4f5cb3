package com.tracking.engine.integration;

import com.tracking.engine.bridge.DeviceStatusRegistry;
import com.tracking.engine.dto.ActivityTransitionEvent;
import com.tracking.engine.dto.GeofenceEvent;
import com.tracking.engine.dto.RecordQuery;
import com.tracking.engine.dto.SessionSnapshot;
import com.tracking.engine.event.TrackingError;
import com.tracking.engine.event.TrackingEventBus;
import com.tracking.engine.event.TrackingEventListener;
import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.motion.ActivityType;
import com.tracking.engine.motion.MotionState;
import com.tracking.engine.platform.NetworkTransport.TransportResponse;
import com.tracking.engine.platform.TransportType;
import com.tracking.engine.service.TrackingSessionService;
import com.tracking.engine.support.IntegrationTestSupport;
import com.tracking.engine.support.TrackingTestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TrackingIntegrationTest extends IntegrationTestSupport {

    private static final String SYNC_URL = "https://example.com/locations";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TrackingSessionService sessionService;

    @Autowired
    private TrackingEventBus events;

    @Autowired
    private DeviceStatusRegistry deviceStatus;

    private final List<TrackingError> errors = new CopyOnWriteArrayList<>();
    private final List<GeofenceEvent> geofenceEvents = new CopyOnWriteArrayList<>();
    private TrackingEventBus.Subscription subscription;

    @BeforeEach
    void setUp() {
        clock.set(TrackingTestConfig.START);
        deviceStatus.updateTransport(TransportType.WIFI);
        deviceStatus.updateAuthorization(true);
        sessionService.await(sessionService.stop());
        sessionService.await(sessionService.removeAllGeofences());
        sessionService.destroyRecords();
        sessionService.await(sessionService.setOdometer(0));
        when(networkTransport.send(anyString(), anyString(), anyMap(), anyString(), any()))
            .thenReturn(new TransportResponse(200, "{}"));

        subscription = events.subscribe(new TrackingEventListener() {
            @Override
            public void onError(TrackingError error) {
                errors.add(error);
            }

            @Override
            public void onGeofence(GeofenceEvent event) {
                geofenceEvents.add(event);
            }
        });
    }

    @AfterEach
    void tearDown() {
        subscription.close();
        sessionService.await(sessionService.stop());
    }

    private void configure(String json) throws Exception {
        mockMvc.perform(post("/api/tracking/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("READY"));
    }

    private void injectFix(double lat, double lon, double accuracy) throws Exception {
        String body = String.format(Locale.ROOT,
                "{\"latitude\":%.6f,\"longitude\":%.6f,\"accuracy\":%.1f,\"timestamp\":\"%s\"}",
                lat, lon, accuracy, clock.instant());
        mockMvc.perform(post("/api/tracking/location")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted());
        clock.advance(Duration.ofSeconds(10));
    }

    @Test
    void shouldReportEveryConfigViolation() throws Exception {
        mockMvc.perform(post("/api/tracking/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"elasticity\":{\"distanceFilter\":-1},\"sync\":{\"maxBatchSize\":0,\"url\":\"ftp://x\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("CONFIG_INVALID"))
                .andExpect(jsonPath("$.violations", hasSize(3)));

        assertThat(errors).extracting(TrackingError::kind).containsExactly(TrackingErrorKind.CONFIG_INVALID);
    }

    @Test
    void shouldStartTrackingAndStoreAcceptedFixes() throws Exception {
        configure("{}");

        mockMvc.perform(post("/api/tracking/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("TRACKING"))
                .andExpect(jsonPath("$.trackingMode").value("LOCATION"))
                .andExpect(jsonPath("$.enabled").value(true));

        injectFix(37.7800, -122.4150, 5);
        injectFix(37.7801, -122.4150, 5);

        mockMvc.perform(get("/api/tracking/records/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2));
        mockMvc.perform(get("/api/tracking/records").param("kind", "LOCATION"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content", hasSize(2)))
                .andExpect(jsonPath("$.content[0].body.latitude").value(37.78))
                .andExpect(jsonPath("$.content[0].synced").value(false));
    }

    @Test
    void shouldPublishOneErrorForDiscardedFix() throws Exception {
        configure("{\"filter\":{\"policy\":\"DISCARD\",\"trackingAccuracyThreshold\":50}}");
        mockMvc.perform(post("/api/tracking/start")).andExpect(status().isOk());

        injectFix(37.7800, -122.4150, 200);

        assertThat(errors).extracting(TrackingError::kind).containsExactly(TrackingErrorKind.FILTER_REJECTED);
        assertThat(sessionService.countRecords()).isZero();
        mockMvc.perform(get("/api/tracking/state"))
                .andExpect(jsonPath("$.rejectedFixes").value(1));
    }

    @Test
    void shouldAccumulateOdometerOnlyWhileMoving() throws Exception {
        configure("{}");
        mockMvc.perform(post("/api/tracking/start")).andExpect(status().isOk());

        injectFix(37.7790, -122.4150, 5);
        injectFix(37.7800, -122.4150, 5);
        mockMvc.perform(get("/api/tracking/odometer"))
                .andExpect(jsonPath("$.odometer").value(0.0));

        mockMvc.perform(post("/api/tracking/pace").param("moving", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.moving").value(true));
        injectFix(37.7810, -122.4150, 5);

        mockMvc.perform(get("/api/tracking/odometer"))
                .andExpect(jsonPath("$.odometer", closeTo(111.2, 0.5)));

        mockMvc.perform(put("/api/tracking/odometer").param("value", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.odometer").value(0.0));
        mockMvc.perform(put("/api/tracking/odometer").param("value", "-5"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldDeclareStationaryAfterStopTimeout() throws Exception {
        configure("{\"motion\":{\"stopTimeout\":\"PT5M\"}}");
        mockMvc.perform(post("/api/tracking/start")).andExpect(status().isOk());
        mockMvc.perform(post("/api/tracking/pace").param("moving", "true")).andExpect(status().isOk());

        sessionService.await(sessionService.onActivity(
                new ActivityTransitionEvent(ActivityType.STILL, true, 90, clock.instant())));
        SessionSnapshot pending = sessionService.await(sessionService.snapshot());
        assertThat(pending.motionState()).isEqualTo(MotionState.PENDING_STOP);
        assertThat(pending.moving()).isTrue();

        timers.advance(Duration.ofMinutes(5));

        SessionSnapshot stationary = sessionService.await(sessionService.snapshot());
        assertThat(stationary.motionState()).isEqualTo(MotionState.STATIONARY);
        assertThat(stationary.moving()).isFalse();
        assertThat(stationary.activity()).isEqualTo("still");
    }

    @Test
    void shouldRejectPaceChangeWhenNotTracking() throws Exception {
        configure("{}");

        mockMvc.perform(post("/api/tracking/pace").param("moving", "true"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STATE"));
    }

    @Test
    void shouldRefuseToStartWithoutPermission() throws Exception {
        configure("{}");
        deviceStatus.updateAuthorization(false);

        mockMvc.perform(post("/api/tracking/start"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("PERMISSION_DENIED"));

        mockMvc.perform(get("/api/tracking/state"))
                .andExpect(jsonPath("$.status").value("READY"));
    }

    @Test
    void shouldKeepRunningSessionWhenModeSwitchIsRefused() throws Exception {
        configure("{}");
        mockMvc.perform(post("/api/tracking/start")).andExpect(status().isOk());
        deviceStatus.updateAuthorization(false);

        mockMvc.perform(post("/api/tracking/start-geofences"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("PERMISSION_DENIED"));

        mockMvc.perform(get("/api/tracking/state"))
                .andExpect(jsonPath("$.status").value("TRACKING"))
                .andExpect(jsonPath("$.trackingMode").value("LOCATION"))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void shouldStopIdempotentlyAndIgnoreLaterFixes() throws Exception {
        configure("{}");
        mockMvc.perform(post("/api/tracking/start")).andExpect(status().isOk());

        mockMvc.perform(post("/api/tracking/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IDLE"));
        mockMvc.perform(post("/api/tracking/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IDLE"));

        injectFix(37.7800, -122.4150, 5);

        assertThat(sessionService.countRecords()).isZero();
    }

    @Test
    void shouldRecordGeofenceEntryAndManageDefinitions() throws Exception {
        configure("{}");
        mockMvc.perform(post("/api/geofences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"HOME\",\"latitude\":37.78,\"longitude\":-122.415,\"radius\":150}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.identifier").value("HOME"));
        mockMvc.perform(get("/api/geofences/HOME"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.radius").value(150.0))
                .andExpect(jsonPath("$.notifyOnEntry").value(true));

        mockMvc.perform(post("/api/tracking/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registeredGeofences").value(1));
        injectFix(37.7800, -122.4150, 5);

        assertThat(geofenceEvents).extracting(GeofenceEvent::identifier).containsExactly("HOME");
        mockMvc.perform(get("/api/tracking/records").param("kind", "GEOFENCE"))
                .andExpect(jsonPath("$.content", hasSize(1)))
                .andExpect(jsonPath("$.content[0].body.geofence.identifier").value("HOME"))
                .andExpect(jsonPath("$.content[0].body.geofence.action").value("ENTER"));

        mockMvc.perform(delete("/api/geofences/HOME"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value("HOME"));
        mockMvc.perform(get("/api/geofences/HOME"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/geofences/HOME"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectInvalidGeofence() throws Exception {
        mockMvc.perform(post("/api/geofences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"\",\"latitude\":95,\"longitude\":-122.415}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void shouldNotStoreLocationsInGeofenceOnlyMode() throws Exception {
        configure("{}");

        mockMvc.perform(post("/api/tracking/start-geofences"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trackingMode").value("GEOFENCE"));
        injectFix(37.7800, -122.4150, 5);

        assertThat(sessionService.countRecords()).isZero();
        mockMvc.perform(get("/api/tracking/state"))
                .andExpect(jsonPath("$.lastLocation.latitude").value(37.78));
    }

    @Test
    void shouldUploadUnsyncedRecordsOnManualSync() throws Exception {
        configure("{\"sync\":{\"url\":\"" + SYNC_URL + "\",\"autoSync\":false,\"batchSync\":true}}");
        mockMvc.perform(post("/api/tracking/start")).andExpect(status().isOk());
        injectFix(37.7800, -122.4150, 5);
        injectFix(37.7801, -122.4150, 5);
        injectFix(37.7802, -122.4150, 5);

        mockMvc.perform(post("/api/tracking/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("STARTED"));

        await().atMost(5, TimeUnit.SECONDS).until(() ->
                sessionService.queryRecords(new RecordQuery(null, null, false, null, 0, 10, true))
                        .getTotalElements() == 0);
        verify(networkTransport, times(1)).send(eq("POST"), eq(SYNC_URL), anyMap(), anyString(), any());
    }

    @Test
    void shouldValidateRecordPaging() throws Exception {
        mockMvc.perform(get("/api/tracking/records").param("size", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"));
    }
}
