package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * A closed movement episode for a vehicle.
 * Each segmentation strategy writes its own trips, tagged by sourceMethod,
 * so the same drive can appear once per strategy.
 */
@Entity
@Table(
    name = "trips",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_trip_vehicle_source_start", columnNames = {"vehicle_id", "source_method", "start_time"})
    },
    indexes = {
        @Index(name = "idx_trip_vehicle_start", columnList = "vehicle_id, start_time")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trip {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_method", nullable = false, length = 16)
    private TripSource sourceMethod;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(nullable = false)
    private LocalDateTime endTime;

    private Double startLatitude;
    private Double startLongitude;
    private Double endLatitude;
    private Double endLongitude;

    @Column(nullable = false)
    private Double distanceKm;

    // How distanceKm was obtained
    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private DistanceMethod distanceMethod;

    private Double maxSpeed;

    private Double avgSpeed;

    @Column(nullable = false)
    private Long durationSeconds;

    private Integer sampleCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
