package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.TripSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Trip entity
 */
@Repository
public interface TripRepository extends JpaRepository<Trip, Long> {

    /**
     * Last closed trip of a strategy that ended before the given time.
     * Incremental segmentation resumes right after its end.
     */
    Optional<Trip> findTopByVehicleIdAndSourceMethodAndEndTimeBeforeOrderByEndTimeDesc(
            String vehicleId, TripSource sourceMethod, LocalDateTime before);

    List<Trip> findByVehicleIdAndStartTimeBetweenOrderByStartTimeAsc(
            String vehicleId, LocalDateTime from, LocalDateTime to);

    List<Trip> findByVehicleIdAndSourceMethodAndStartTimeBetweenOrderByStartTimeAsc(
            String vehicleId, TripSource sourceMethod, LocalDateTime from, LocalDateTime to);

    /** Half-open day window [from, to) on start time */
    List<Trip> findByVehicleIdAndSourceMethodAndStartTimeGreaterThanEqualAndStartTimeLessThan(
            String vehicleId, TripSource sourceMethod, LocalDateTime from, LocalDateTime to);

    @Modifying
    @Query("DELETE FROM Trip t WHERE t.vehicleId = :vehicleId AND t.sourceMethod = :source AND t.startTime > :after")
    int deleteStartingAfter(@Param("vehicleId") String vehicleId,
                            @Param("source") TripSource source,
                            @Param("after") LocalDateTime after);

    @Modifying
    @Query("DELETE FROM Trip t WHERE t.vehicleId = :vehicleId AND t.sourceMethod = :source")
    int deleteAllForSource(@Param("vehicleId") String vehicleId, @Param("source") TripSource source);

    @Modifying
    @Query("DELETE FROM Trip t WHERE t.vehicleId = :vehicleId AND t.sourceMethod = :source " +
           "AND t.startTime >= :from AND t.startTime <= :to")
    int deleteStartingBetween(@Param("vehicleId") String vehicleId,
                              @Param("source") TripSource source,
                              @Param("from") LocalDateTime from,
                              @Param("to") LocalDateTime to);

    @Query("SELECT DISTINCT t.vehicleId FROM Trip t WHERE t.startTime >= :from AND t.startTime < :to")
    List<String> findActiveVehicleIds(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
