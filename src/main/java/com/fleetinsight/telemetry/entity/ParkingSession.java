package com.fleetinsight.telemetry.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * A stationary episode of a vehicle: parked with ignition off, or idling.
 * Opened when the vehicle stops, closed when it moves again.
 */
@Entity
@Table(
    name = "parking_sessions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_parking_session_vehicle_start", columnNames = {"vehicle_id", "start_time"})
    },
    indexes = {
        @Index(name = "idx_parking_session_vehicle_status", columnList = "vehicle_id, status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParkingSession {

    public enum Trigger { IGNITION_OFF, IDLE }

    public enum Status { OPEN, CLOSED, TOO_SHORT }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false, length = 64)
    private String vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_trigger", nullable = false, length = 16)
    private Trigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    private LocalDateTime endTime;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Long durationMinutes;

    /** Learned location the visit was merged into, once closed */
    private Long locationId;
}
