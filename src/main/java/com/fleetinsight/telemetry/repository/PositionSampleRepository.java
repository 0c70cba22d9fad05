package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Read/append access to the per-vehicle sample timeline.
 * All range queries return samples oldest-first.
 */
@Repository
public interface PositionSampleRepository extends JpaRepository<PositionSample, Long> {

    // ── Dedupe ────────────────────────────────────────────────────────────────

    /** Stored copy of a (vehicle, timestamp) reading */
    Optional<PositionSample> findByVehicleIdAndTimestamp(String vehicleId, LocalDateTime timestamp);

    /** true when the vehicle already has a later sample, i.e. the given one arrived late */
    boolean existsByVehicleIdAndTimestampAfter(String vehicleId, LocalDateTime timestamp);

    // ── Neighbours ────────────────────────────────────────────────────────────

    /** Latest sample for a vehicle (last-sample cache fallback) */
    Optional<PositionSample> findTopByVehicleIdOrderByTimestampDesc(String vehicleId);

    /** The sample immediately preceding the given time */
    Optional<PositionSample> findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(String vehicleId,
                                                                                      LocalDateTime timestamp);

    /** The sample immediately following the given time */
    Optional<PositionSample> findFirstByVehicleIdAndTimestampAfterOrderByTimestampAsc(String vehicleId,
                                                                                      LocalDateTime timestamp);

    /** Most recent ignition-off sample before the given time */
    Optional<PositionSample> findTopByVehicleIdAndIgnitionOnFalseAndTimestampBeforeOrderByTimestampDesc(
            String vehicleId, LocalDateTime timestamp);

    /** First sample strictly inside (after, before) */
    Optional<PositionSample> findFirstByVehicleIdAndTimestampAfterAndTimestampBeforeOrderByTimestampAsc(
            String vehicleId, LocalDateTime after, LocalDateTime before);

    /** Very first sample of a vehicle before the given time */
    Optional<PositionSample> findFirstByVehicleIdAndTimestampBeforeOrderByTimestampAsc(String vehicleId,
                                                                                      LocalDateTime before);

    // ── Ranges ────────────────────────────────────────────────────────────────

    List<PositionSample> findByVehicleIdOrderByTimestampAsc(String vehicleId);

    List<PositionSample> findByVehicleIdAndTimestampAfterOrderByTimestampAsc(String vehicleId, LocalDateTime after);

    List<PositionSample> findByVehicleIdAndTimestampGreaterThanEqualOrderByTimestampAsc(String vehicleId,
                                                                                       LocalDateTime from);

    /** Inclusive on both ends */
    List<PositionSample> findByVehicleIdAndTimestampBetweenOrderByTimestampAsc(String vehicleId,
                                                                              LocalDateTime from,
                                                                              LocalDateTime to);

    /** Half-open day window [from, to) */
    List<PositionSample> findByVehicleIdAndTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAsc(
            String vehicleId, LocalDateTime from, LocalDateTime to);

    /** Bounding-box prefilter for samples near a learned location */
    List<PositionSample> findByVehicleIdAndTimestampAfterAndLatitudeBetweenAndLongitudeBetween(
            String vehicleId, LocalDateTime after,
            double minLat, double maxLat, double minLon, double maxLon);

    // ── Idle run lookup ───────────────────────────────────────────────────────

    /**
     * Time of the latest sample in (from, to] that breaks a low-speed ignition-on run,
     * i.e. ignition off/unknown or speed at or above the threshold. Null when none.
     */
    @Query("SELECT MAX(p.timestamp) FROM PositionSample p " +
           "WHERE p.vehicleId = :vehicleId AND p.timestamp > :from AND p.timestamp <= :to " +
           "AND (p.ignitionOn IS NULL OR p.ignitionOn = false OR p.speed IS NULL OR p.speed >= :speedThreshold)")
    LocalDateTime findLastIdleBreakTime(@Param("vehicleId") String vehicleId,
                                        @Param("from") LocalDateTime from,
                                        @Param("to") LocalDateTime to,
                                        @Param("speedThreshold") double speedThreshold);

    /** Earliest sample time in (after, to]. Null when none. */
    @Query("SELECT MIN(p.timestamp) FROM PositionSample p " +
           "WHERE p.vehicleId = :vehicleId AND p.timestamp > :after AND p.timestamp <= :to")
    LocalDateTime findFirstTimeAfter(@Param("vehicleId") String vehicleId,
                                     @Param("after") LocalDateTime after,
                                     @Param("to") LocalDateTime to);

    // ── Activity ──────────────────────────────────────────────────────────────

    @Query("SELECT DISTINCT p.vehicleId FROM PositionSample p WHERE p.timestamp >= :from AND p.timestamp < :to")
    List<String> findActiveVehicleIds(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
