package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.LearnedLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LearnedLocationRepository extends JpaRepository<LearnedLocation, Long> {

    List<LearnedLocation> findByVehicleId(String vehicleId);

    /** Ranked list: most visited first, ties broken by most recent visit */
    List<LearnedLocation> findByVehicleIdOrderByVisitCountDescLastVisitDesc(String vehicleId);

    // Bounding-box prefilters for proximity lookups; exact distance is checked in the service
    List<LearnedLocation> findByLatitudeBetweenAndLongitudeBetween(double minLat, double maxLat,
                                                                   double minLon, double maxLon);

    List<LearnedLocation> findByVehicleIdAndLatitudeBetweenAndLongitudeBetween(String vehicleId,
                                                                               double minLat, double maxLat,
                                                                               double minLon, double maxLon);
}
