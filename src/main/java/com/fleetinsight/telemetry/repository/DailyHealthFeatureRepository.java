package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.DailyHealthFeature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface DailyHealthFeatureRepository extends JpaRepository<DailyHealthFeature, Long> {

    Optional<DailyHealthFeature> findByVehicleIdAndScoreDate(String vehicleId, LocalDate scoreDate);
}
