package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Daily 0..100 health score for one vehicle, with its confidence, trend and
 * the four component scores it was weighted from.
 */
@Entity
@Table(
    name = "daily_health_scores",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_health_score_vehicle_date", columnNames = {"vehicle_id", "score_date"})
    },
    indexes = {
        @Index(name = "idx_health_score_date", columnList = "score_date")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyHealthScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    @Column(name = "score_date", nullable = false)
    private LocalDate scoreDate;

    @Column(nullable = false)
    private int healthScore;

    @Column(nullable = false)
    private int confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private HealthTrend trend;

    private int connectivityScore;
    private int safetyScore;
    private int utilizationScore;
    private int dataQualityScore;

    /** Score of the most recent earlier day, if any, that the trend was derived from */
    private Integer previousScore;

    @Column(nullable = false, length = 32)
    private String modelVersion;

    private LocalDateTime computedAt;
}
