package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.LearnedLocation;
import com.fleetinsight.telemetry.entity.ParkingSession;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.repository.ParkingSessionRepository;
import com.fleetinsight.telemetry.service.location.DwellEpisodeExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Live parking tracker feeding the Location Clusterer.
 *
 * moving → stationary opens a session at the current sample.
 * stationary → moving closes the open session; a session of at least
 * min-dwell-minutes is merged into the learned locations, a shorter one is kept as TOO_SHORT.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingSessionService {

    private final ParkingSessionRepository parkingSessionRepository;
    private final LocationClusteringService locationClusteringService;
    private final DwellEpisodeExtractor dwellEpisodeExtractor;

    @Value("${telemetry.locations.min-dwell-minutes:15}")
    private long minDwellMinutes;

    /**
     * Only called for in-order samples; late samples are covered by learnFromHistory.
     *
     * @param previous the sample before {@code current}, null for a vehicle's first sample
     */
    @Transactional
    public Optional<ParkingSession> onSample(PositionSample previous, PositionSample current) {
        if (previous == null) {
            return Optional.empty();
        }
        boolean wasStationary = dwellEpisodeExtractor.isStationary(previous);
        boolean stationary = dwellEpisodeExtractor.isStationary(current);

        if (!wasStationary && stationary) {
            return Optional.of(open(current));
        }
        if (wasStationary && !stationary) {
            return parkingSessionRepository
                    .findTopByVehicleIdAndStatusOrderByStartTimeDesc(current.getVehicleId(), ParkingSession.Status.OPEN)
                    .map(session -> close(session, current));
        }
        return Optional.empty();
    }

    @Transactional(readOnly = true)
    public List<ParkingSession> findSessions(String vehicleId) {
        return parkingSessionRepository.findByVehicleIdOrderByStartTimeDesc(vehicleId);
    }

    private ParkingSession open(PositionSample sample) {
        ParkingSession session = ParkingSession.builder()
                .vehicleId(sample.getVehicleId())
                .trigger(sample.hasIgnitionOn() ? ParkingSession.Trigger.IDLE : ParkingSession.Trigger.IGNITION_OFF)
                .status(ParkingSession.Status.OPEN)
                .startTime(sample.getTimestamp())
                .latitude(sample.getLatitude())
                .longitude(sample.getLongitude())
                .build();
        session = parkingSessionRepository.save(session);
        log.debug("CLUSTER: parking session #{} opened for vehicle {} at {} ({})",
                session.getId(), sample.getVehicleId(), sample.getTimestamp(), session.getTrigger());
        return session;
    }

    private ParkingSession close(ParkingSession session, PositionSample current) {
        long minutes = Duration.between(session.getStartTime(), current.getTimestamp()).toMinutes();
        session.setEndTime(current.getTimestamp());
        session.setDurationMinutes(minutes);

        if (minutes >= minDwellMinutes) {
            LearnedLocation location = locationClusteringService.recordVisit(session.getVehicleId(),
                    session.getLatitude(), session.getLongitude(), minutes,
                    session.getStartTime(), session.getEndTime());
            session.setLocationId(location.getId());
            session.setStatus(ParkingSession.Status.CLOSED);
            log.info("CLUSTER: parking session #{} closed for vehicle {} — {} min at location #{}",
                    session.getId(), session.getVehicleId(), minutes, location.getId());
        } else {
            session.setStatus(ParkingSession.Status.TOO_SHORT);
            log.debug("CLUSTER: parking session #{} for vehicle {} too short ({} min)",
                    session.getId(), session.getVehicleId(), minutes);
        }
        return parkingSessionRepository.save(session);
    }
}
