package com.tracking.engine.config;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What gets persisted and for how long.
 *
 * @param persistMode         record kinds that are written
 * @param maxDaysToPersist    age limit in days, 0 or less means unlimited
 * @param maxRecordsToPersist count limit, 0 or less means unlimited
 * @param extras              merged into the body of every record
 * @param locationTemplate    read-time template for location records, optional
 * @param geofenceTemplate    read-time template for geofence records, optional
 */
@Builder(toBuilder = true)
public record RetentionConfig(
    @NotNull PersistMode persistMode,
    Integer maxDaysToPersist,
    Integer maxRecordsToPersist,
    Map<String, Object> extras,
    String locationTemplate,
    String geofenceTemplate
) {

    public RetentionConfig {
        if (persistMode == null) {
            persistMode = PersistMode.ALL;
        }
        if (maxDaysToPersist == null) {
            maxDaysToPersist = 0;
        }
        if (maxRecordsToPersist == null) {
            maxRecordsToPersist = 0;
        }
        extras = extras == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static RetentionConfig defaults() {
        return RetentionConfig.builder().build();
    }

    public boolean ageLimitEnabled() {
        return maxDaysToPersist > 0;
    }

    public boolean countLimitEnabled() {
        return maxRecordsToPersist > 0;
    }
}
