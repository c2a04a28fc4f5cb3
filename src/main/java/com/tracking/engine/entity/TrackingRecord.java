package com.tracking.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted location fix or geofence event.
 *
 * The identity column gives strictly increasing ids in insertion order, which
 * is the order used by sync and by count-based retention. The body is stored
 * as JSON with the configured extras already merged in.
 */
@Entity
@Table(
    name = "tracking_records",
    indexes = {
        @Index(name = "idx_record_synced", columnList = "synced, id"),
        @Index(name = "idx_record_created_at", columnList = "created_at"),
        @Index(name = "idx_record_recorded_at", columnList = "recorded_at")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String uuid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecordKind kind;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double accuracy;

    /**
     * Device time of the fix (or of the geofence transition)
     */
    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    /**
     * Insert time, drives age-based retention
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean synced;

    @Column(nullable = false, length = 10000)
    private String payload;
}
