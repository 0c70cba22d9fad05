package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for VehicleEvent.
 *
 * The composite index (vehicle_id, event_type, created_at) backs the cooldown lookup.
 */
@Repository
public interface VehicleEventRepository extends JpaRepository<VehicleEvent, Long> {

    // ── Cooldown guard ────────────────────────────────────────────────────────

    /** True if an event of this type exists strictly inside (from, to) */
    boolean existsByVehicleIdAndEventTypeAndCreatedAtGreaterThanAndCreatedAtLessThan(
            String vehicleId, EventType eventType, LocalDateTime from, LocalDateTime to);

    /** Events recorded for one sample (created_at is the sample time) */
    List<VehicleEvent> findByVehicleIdAndCreatedAt(String vehicleId, LocalDateTime createdAt);

    // ── Queries ───────────────────────────────────────────────────────────────

    /**
     * Filtered event timeline for one vehicle, newest first.
     * Null filter arguments are ignored.
     */
    @Query("SELECT e FROM VehicleEvent e WHERE e.vehicleId = :vehicleId " +
           "AND (:from IS NULL OR e.createdAt >= :from) " +
           "AND (:to IS NULL OR e.createdAt <= :to) " +
           "AND (:acknowledged IS NULL OR e.acknowledged = :acknowledged) " +
           "AND (:severity IS NULL OR e.severity = :severity) " +
           "AND (:eventType IS NULL OR e.eventType = :eventType) " +
           "ORDER BY e.createdAt DESC")
    List<VehicleEvent> search(@Param("vehicleId") String vehicleId,
                              @Param("from") LocalDateTime from,
                              @Param("to") LocalDateTime to,
                              @Param("acknowledged") Boolean acknowledged,
                              @Param("severity") EventSeverity severity,
                              @Param("eventType") EventType eventType);

    /** Half-open window [from, to), oldest first */
    List<VehicleEvent> findByVehicleIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
            String vehicleId, LocalDateTime from, LocalDateTime to);

    /** Rows of [eventType, severity, count] */
    @Query("SELECT e.eventType, e.severity, COUNT(e) FROM VehicleEvent e " +
           "WHERE e.vehicleId = :vehicleId AND e.createdAt >= :since " +
           "GROUP BY e.eventType, e.severity")
    List<Object[]> countByTypeAndSeverity(@Param("vehicleId") String vehicleId,
                                          @Param("since") LocalDateTime since);

    @Query("SELECT DISTINCT e.vehicleId FROM VehicleEvent e WHERE e.createdAt >= :from AND e.createdAt < :to")
    List<String> findActiveVehicleIds(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    // ── Retention ─────────────────────────────────────────────────────────────

    @Modifying
    @Query("DELETE FROM VehicleEvent e WHERE e.acknowledged = true AND e.expiresAt IS NOT NULL AND e.expiresAt < :now")
    int deleteExpiredAcknowledged(@Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM VehicleEvent e WHERE e.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);

    @Modifying
    @Query("DELETE FROM VehicleEvent e WHERE e.severity = :severity AND e.createdAt < :cutoff")
    int deleteBySeverityOlderThan(@Param("severity") EventSeverity severity,
                                  @Param("cutoff") LocalDateTime cutoff);
}
