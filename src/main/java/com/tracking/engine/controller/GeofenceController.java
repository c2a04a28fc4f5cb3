package com.tracking.engine.controller;

import com.tracking.engine.dto.GeofenceBatchRequest;
import com.tracking.engine.dto.GeofenceRegion;
import com.tracking.engine.service.TrackingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Geofence registration.
 *
 * Definitions are persisted and survive restarts. While tracking, the
 * running session picks them up immediately; at most the platform capacity
 * of them (the nearest ones) is monitored at a time.
 */
@RestController
@RequestMapping("/api/geofences")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geofences", description = "Register, list and remove geofences")
public class GeofenceController {

    private final TrackingSessionService sessionService;

    @Operation(
            summary = "Add a geofence",
            description = "Adding an identifier that already exists replaces the previous definition."
    )
    @PostMapping
    public ResponseEntity<GeofenceRegion> add(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Circular region, or polygon when vertices are given",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = GeofenceRegion.class),
                            examples = @ExampleObject(
                                    value = "{\"identifier\":\"HOME\",\"latitude\":37.78,\"longitude\":-122.415,\"radius\":150,\"notifyOnDwell\":true,\"loiteringDelay\":60000}"
                            )
                    )
            )
            @Valid @RequestBody GeofenceRegion region) {
        log.info("Adding geofence: {}", region.toLogString());
        List<GeofenceRegion> saved = sessionService.await(sessionService.addGeofences(List.of(region)));
        return ResponseEntity.status(HttpStatus.CREATED).body(saved.get(0));
    }

    @Operation(summary = "Add several geofences at once")
    @PostMapping("/batch")
    public ResponseEntity<List<GeofenceRegion>> addAll(@Valid @RequestBody GeofenceBatchRequest request) {
        log.info("Adding {} geofences", request.geofences().size());
        List<GeofenceRegion> saved = sessionService.await(sessionService.addGeofences(request.geofences()));
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @Operation(summary = "List geofences in registration order")
    @GetMapping
    public ResponseEntity<List<GeofenceRegion>> list() {
        return ResponseEntity.ok(sessionService.listGeofences());
    }

    @Operation(summary = "Get one geofence", description = "Served from the definition cache when warm.")
    @GetMapping("/{identifier}")
    public ResponseEntity<GeofenceRegion> get(
            @Parameter(description = "Geofence identifier", example = "HOME") @PathVariable String identifier) {
        GeofenceRegion region = sessionService.findGeofence(identifier);
        if (region == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(region);
    }

    @DeleteMapping("/{identifier}")
    public ResponseEntity<?> remove(@PathVariable String identifier) {
        boolean removed = sessionService.await(sessionService.removeGeofence(identifier));
        if (!removed) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("removed", identifier));
    }

    @Operation(summary = "Remove every geofence")
    @DeleteMapping
    public ResponseEntity<?> removeAll() {
        long removed = sessionService.await(sessionService.removeAllGeofences());
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
