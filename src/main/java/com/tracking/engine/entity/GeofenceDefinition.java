package com.tracking.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Stored geofence definition. Ids follow registration order, which breaks
 * distance ties when the monitored window is built.
 */
@Entity
@Table(
    name = "geofence_definitions",
    indexes = {
        @Index(name = "idx_geofence_identifier", columnList = "identifier", unique = true)
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String identifier;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(nullable = false)
    private Double radius;

    @Column(name = "notify_on_entry", nullable = false)
    private Boolean notifyOnEntry;

    @Column(name = "notify_on_exit", nullable = false)
    private Boolean notifyOnExit;

    @Column(name = "notify_on_dwell", nullable = false)
    private Boolean notifyOnDwell;

    /**
     * Milliseconds, 0 uses the session's dwell delay
     */
    @Column(name = "loitering_delay", nullable = false)
    private Long loiteringDelay;

    /**
     * JSON object
     */
    @Column(length = 4000)
    private String extras;

    /**
     * JSON array of [lat, lon] pairs, null for circles
     */
    @Column(length = 8000)
    private String vertices;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
