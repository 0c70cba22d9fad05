package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.LocationVisitPattern;
import com.fleetinsight.telemetry.entity.TimeOfDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LocationVisitPatternRepository extends JpaRepository<LocationVisitPattern, Long> {

    List<LocationVisitPattern> findByLocationId(Long locationId);

    Optional<LocationVisitPattern> findByLocationIdAndTimeBucket(Long locationId, TimeOfDay timeBucket);
}
