package com.fleetinsight.telemetry.repository;

import com.fleetinsight.telemetry.entity.ParkingSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ParkingSessionRepository extends JpaRepository<ParkingSession, Long> {

    Optional<ParkingSession> findTopByVehicleIdAndStatusOrderByStartTimeDesc(String vehicleId,
                                                                            ParkingSession.Status status);

    boolean existsByVehicleIdAndStartTime(String vehicleId, LocalDateTime startTime);

    List<ParkingSession> findByVehicleIdOrderByStartTimeDesc(String vehicleId);
}
