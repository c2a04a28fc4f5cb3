package com.tracking.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record GeofenceBatchRequest(
    @NotEmpty(message = "At least one geofence is required")
    List<@Valid GeofenceRegion> geofences
) {
}
