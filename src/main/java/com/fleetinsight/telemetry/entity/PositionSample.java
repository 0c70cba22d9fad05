package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * One timestamped position/status reading for a vehicle.
 *
 * Written once by the ingestion stage; the only later change is setting
 * {@code evaluated} once event detection has run for it. The unique key on
 * (vehicle_id, sample_time) makes re-delivery of an evaluated reading a no-op.
 *
 * Units:
 *  - speed          : km/h
 *  - batteryPercent : 0..100
 *  - odometerTotal  : cumulative meters reported by the device
 */
@Entity
@Table(
    name = "position_samples",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_position_sample_vehicle_time", columnNames = {"vehicle_id", "sample_time"})
    },
    indexes = {
        @Index(name = "idx_position_sample_vehicle_time", columnList = "vehicle_id, sample_time")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    /** Device (GPS) time of the reading */
    @Column(name = "sample_time", nullable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double speed;

    private Boolean ignitionOn;

    private Integer batteryPercent;

    private Double odometerTotal;

    private Boolean online;

    /** Event detection completed for this sample; redelivery retries it while false */
    @Column(nullable = false)
    private boolean evaluated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    public boolean hasIgnitionOn() {
        return Boolean.TRUE.equals(ignitionOn);
    }

    public double speedOrZero() {
        return speed != null ? speed : 0.0;
    }
}
