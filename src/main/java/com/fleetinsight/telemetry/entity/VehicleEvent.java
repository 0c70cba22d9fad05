package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A discrete, typed, severity-tagged occurrence derived from two consecutive samples.
 *
 * Fields:
 *  - createdAt    : time of the sample that produced the event (drives cooldown and retention)
 *  - recordedAt   : server time the row was written
 *  - expiresAt    : after this the event is stale for dashboards and purge-eligible once acknowledged
 *  - valueBefore/valueAfter/threshold : the compared readings, when the rule has them
 *
 * DB Indexes:
 *  - idx_vehicle_event_vehicle_type_time : cooldown lookup per (vehicle, type)
 *  - idx_vehicle_event_vehicle_time      : per-vehicle timeline queries
 */
@Entity
@Table(
    name = "vehicle_events",
    indexes = {
        @Index(name = "idx_vehicle_event_vehicle_type_time", columnList = "vehicle_id, event_type, created_at"),
        @Index(name = "idx_vehicle_event_vehicle_time",      columnList = "vehicle_id, created_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private EventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EventSeverity severity;

    @Column(nullable = false)
    private String title;

    @Column(length = 1000)
    private String description;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Double latitude;

    private Double longitude;

    private Double valueBefore;

    private Double valueAfter;

    private Double threshold;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean acknowledged;

    private LocalDateTime acknowledgedAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    @PrePersist
    protected void onCreate() {
        if (this.recordedAt == null) {
            this.recordedAt = LocalDateTime.now();
        }
    }
}
