package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * A spatial cluster of repeated dwell points for one vehicle.
 *
 * The centroid moves to the midpoint of (old centroid, new point) on every merge,
 * so it follows recent visits rather than the mean of all visits.
 * Rows are never deleted automatically.
 */
@Entity
@Table(
    name = "learned_locations",
    indexes = {
        @Index(name = "idx_learned_location_vehicle", columnList = "vehicle_id"),
        @Index(name = "idx_learned_location_lat_lon", columnList = "latitude, longitude")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LearnedLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    /** Centroid latitude */
    @Column(nullable = false)
    private Double latitude;

    /** Centroid longitude */
    @Column(nullable = false)
    private Double longitude;

    @Column(nullable = false)
    private Double radiusMeters;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LocationType locationType;

    private String customLabel;

    @Column(nullable = false)
    private Integer visitCount;

    @Column(nullable = false)
    private Long totalDurationMinutes;

    private LocalDateTime firstVisit;

    private LocalDateTime lastVisit;

    private Integer typicalArrivalHour;

    private Integer typicalDurationMinutes;

    /** 0..1, reaches 1.0 at twenty visits or when labelled by hand */
    @Column(nullable = false)
    private Double confidence;

    /** false once a label was set by hand; auto-classification then leaves the type alone */
    @Column(nullable = false)
    private boolean autoDetected;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
