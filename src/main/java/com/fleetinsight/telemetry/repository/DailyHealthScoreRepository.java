package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.DailyHealthScore;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyHealthScoreRepository extends JpaRepository<DailyHealthScore, Long> {

    Optional<DailyHealthScore> findByVehicleIdAndScoreDate(String vehicleId, LocalDate scoreDate);

    /** Most recent score strictly before the given day (trend baseline) */
    Optional<DailyHealthScore> findTopByVehicleIdAndScoreDateBeforeOrderByScoreDateDesc(String vehicleId,
                                                                                        LocalDate scoreDate);

    List<DailyHealthScore> findByVehicleIdAndScoreDateBetweenOrderByScoreDateDesc(String vehicleId,
                                                                                 LocalDate from,
                                                                                 LocalDate to);
}
