package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Visit statistics of one learned location within one time-of-day bucket.
 * typicalHour and avgDurationMinutes are visit-count weighted averages.
 */
@Entity
@Table(
    name = "location_visit_patterns",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_visit_pattern_location_bucket", columnNames = {"location_id", "time_bucket"})
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationVisitPattern {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "location_id", nullable = false)
    private Long locationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "time_bucket", nullable = false, length = 16)
    private TimeOfDay timeBucket;

    @Column(nullable = false)
    private Integer visitCount;

    @Column(nullable = false)
    private Double typicalHour;

    @Column(nullable = false)
    private Double avgDurationMinutes;
}
