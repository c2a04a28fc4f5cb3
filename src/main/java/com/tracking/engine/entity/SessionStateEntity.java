package com.tracking.engine.entity;

import com.tracking.engine.dto.TrackingMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single-row session state blob.
 */
@Entity
@Table(name = "session_state")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionStateEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "tracking_mode", length = 20)
    private TrackingMode trackingMode;

    @Column(name = "scheduler_enabled", nullable = false)
    private boolean schedulerEnabled;

    @Column(nullable = false)
    private double odometer;

    @Column(nullable = false)
    private boolean moving;

    @Column(name = "last_fix_time")
    private Instant lastFixTime;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
