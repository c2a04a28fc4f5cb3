package com.tracking.engine.controller;

import com.tracking.engine.config.TrackingConfig;
import com.tracking.engine.dto.LocationSample;
import com.tracking.engine.dto.RecordQuery;
import com.tracking.engine.dto.RecordView;
import com.tracking.engine.dto.SessionSnapshot;
import com.tracking.engine.entity.RecordKind;
import com.tracking.engine.service.TrackingSessionService;
import com.tracking.engine.sync.DrainOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * REST surface of the tracking session.
 *
 * Lifecycle:
 * 1. POST /api/tracking/config with a configuration snapshot (READY)
 * 2. POST /api/tracking/start or /start-geofences (TRACKING)
 * 3. POST /api/tracking/stop (IDLE)
 *
 * Device input normally arrives over STOMP (see {@link DeviceStreamController});
 * POST /api/tracking/location injects a single fix for testing.
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tracking", description = "Session lifecycle, records, sync and retention")
public class TrackingController {

    private final TrackingSessionService sessionService;

    @Operation(
            summary = "Apply a configuration snapshot",
            description = "Validates the whole snapshot. Every violation is reported; an invalid snapshot changes nothing."
    )
    @PostMapping("/config")
    public ResponseEntity<SessionSnapshot> configure(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Tracking configuration; omitted sections use defaults",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = TrackingConfig.class),
                            examples = @ExampleObject(
                                    value = "{\"elasticity\":{\"distanceFilter\":10},\"motion\":{\"stopTimeout\":\"PT5M\"},\"sync\":{\"url\":\"https://example.com/locations\",\"batchSync\":true}}"
                            )
                    )
            )
            @RequestBody TrackingConfig config) {
        log.info("Received configuration snapshot");
        return ResponseEntity.ok(sessionService.await(sessionService.configure(config)));
    }

    @Operation(summary = "Start location tracking")
    @PostMapping("/start")
    public ResponseEntity<SessionSnapshot> start() {
        return ResponseEntity.ok(sessionService.await(sessionService.start()));
    }

    @Operation(
            summary = "Start geofence-only tracking",
            description = "Fixes drive geofence evaluation only; no location records are stored or published."
    )
    @PostMapping("/start-geofences")
    public ResponseEntity<SessionSnapshot> startGeofences() {
        return ResponseEntity.ok(sessionService.await(sessionService.startGeofences()));
    }

    @Operation(summary = "Stop tracking", description = "Idempotent. The configuration is kept for the next start.")
    @PostMapping("/stop")
    public ResponseEntity<SessionSnapshot> stop() {
        return ResponseEntity.ok(sessionService.await(sessionService.stop()));
    }

    @Operation(summary = "Force the motion state")
    @PostMapping("/pace")
    public ResponseEntity<SessionSnapshot> changePace(
            @Parameter(description = "true to declare moving, false to declare stationary", example = "true")
            @RequestParam boolean moving) {
        return ResponseEntity.ok(sessionService.await(sessionService.changePace(moving)));
    }

    @Operation(summary = "Current session snapshot")
    @GetMapping("/state")
    public ResponseEntity<SessionSnapshot> state() {
        return ResponseEntity.ok(sessionService.await(sessionService.snapshot()));
    }

    @GetMapping("/odometer")
    public ResponseEntity<?> odometer() {
        return ResponseEntity.ok(Map.of("odometer", sessionService.await(sessionService.odometer())));
    }

    @Operation(summary = "Reset or set the odometer", description = "Value in meters, must be >= 0")
    @PutMapping("/odometer")
    public ResponseEntity<?> setOdometer(@RequestParam(defaultValue = "0") double value) {
        return ResponseEntity.ok(Map.of("odometer", sessionService.await(sessionService.setOdometer(value))));
    }

    /**
     * Inject a fix as if the location provider had delivered it.
     *
     * Example:
     * POST /api/tracking/location
     * {"latitude":37.78,"longitude":-122.415,"accuracy":5,"speed":3.2,"timestamp":"2024-01-01T12:00:00Z"}
     */
    @Operation(summary = "Inject a location fix")
    @PostMapping("/location")
    public ResponseEntity<?> injectLocation(@Valid @RequestBody LocationSample sample) {
        log.debug("Injected fix: {}", sample.toLogString());
        sessionService.await(sessionService.onLocation(sample));
        return ResponseEntity.accepted().body(Map.of("status", "ACCEPTED"));
    }

    @Operation(
            summary = "Query stored records",
            description = "Paged, filterable by fix time, sync status and kind. Bodies are rendered through the configured templates."
    )
    @GetMapping("/records")
    public ResponseEntity<Page<RecordView>> records(
            @Parameter(description = "Fix time lower bound (inclusive)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @Parameter(description = "Fix time upper bound (exclusive)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Boolean synced,
            @RequestParam(required = false) RecordKind kind,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size,
            @RequestParam(defaultValue = "true") boolean ascending) {
        if (page < 0 || size < 1 || size > 1000) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and 1000");
        }
        RecordQuery query = new RecordQuery(from, to, synced, kind, page, size, ascending);
        return ResponseEntity.ok(sessionService.queryRecords(query));
    }

    @GetMapping("/records/count")
    public ResponseEntity<?> countRecords() {
        return ResponseEntity.ok(Map.of("count", sessionService.countRecords()));
    }

    @Operation(summary = "Delete every stored record")
    @DeleteMapping("/records")
    public ResponseEntity<?> destroyRecords() {
        long deleted = sessionService.destroyRecords();
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    @Operation(
            summary = "Upload unsynced records now",
            description = "Manual drain. Un-parks a pipeline that gave up after repeated failures."
    )
    @PostMapping("/sync")
    public ResponseEntity<?> sync() {
        DrainOutcome outcome = sessionService.syncNow();
        return ResponseEntity.ok(Map.of("outcome", outcome));
    }

    @Operation(summary = "Apply retention limits now")
    @PostMapping("/prune")
    public ResponseEntity<?> prune() {
        int deleted = sessionService.pruneNow();
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }
}
