package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Pure aggregation of one vehicle-day of samples, trips and events.
 * One row per (vehicle_id, score_date); recomputing overwrites it in place.
 */
@Entity
@Table(
    name = "daily_health_features",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_health_feature_vehicle_date", columnNames = {"vehicle_id", "score_date"})
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyHealthFeature {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    @Column(name = "score_date", nullable = false)
    private LocalDate scoreDate;

    // ── Samples ───────────────────────────────────────────────────────────────
    private int pointsCount;
    private int transitionCount;
    private Double avgSamplingIntervalMinutes;
    private double maxGapMinutes;
    private int impossibleJumpCount;
    private double gpsDriftRatio;
    private double speedingExposurePct;
    private double expectedPoints;
    private double dataCompletenessPct;
    private boolean lowSampleDay;

    // ── Trips ─────────────────────────────────────────────────────────────────
    private int tripCount;
    private double distanceKm;
    private double movingMinutes;

    // ── Events ────────────────────────────────────────────────────────────────
    private double idleMinutes;
    private int idleEventCount;
    private int overspeedEventCount;
    private int harshEventCount;
    private int offlineEventCount;

    // ── Battery ───────────────────────────────────────────────────────────────
    private Double avgBatteryPercent;
    private Integer minBatteryPercent;

    private LocalDateTime computedAt;
}
