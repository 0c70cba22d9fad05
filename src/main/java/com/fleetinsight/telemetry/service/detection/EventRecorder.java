package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.repository.VehicleEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Cooldown check plus insert for a single event candidate.
 *
 * Runs in its own transaction so the row is committed when the call returns;
 * callers hold the (vehicle, type) lock across the call, which makes
 * check-then-insert atomic per key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventRecorder {

    private final VehicleEventRepository vehicleEventRepository;

    @Value("${telemetry.events.cooldown-minutes:5}")
    private int cooldownMinutes;

    @Value("${telemetry.events.moving-cooldown-minutes:10}")
    private int movingCooldownMinutes;

    @Value("${telemetry.events.expiry.default-hours:24}")
    private int defaultExpiryHours;

    @Value("${telemetry.events.expiry.ignition-hours:2}")
    private int ignitionExpiryHours;

    @Value("${telemetry.events.expiry.trip-completed-hours:4}")
    private int tripCompletedExpiryHours;

    @Value("${telemetry.events.expiry.short-lived-hours:1}")
    private int shortLivedExpiryHours;

    /**
     * Persists the candidate unless an event of the same type for the vehicle
     * exists within the cooldown window on either side of {@code occurredAt}.
     *
     * @return the saved event, or empty if suppressed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<VehicleEvent> recordIfOutsideCooldown(String vehicleId, LocalDateTime occurredAt,
                                                          EventCandidate candidate) {
        Duration cooldown = cooldownFor(candidate.getEventType());
        boolean recent = vehicleEventRepository.existsByVehicleIdAndEventTypeAndCreatedAtGreaterThanAndCreatedAtLessThan(
                vehicleId, candidate.getEventType(), occurredAt.minus(cooldown), occurredAt.plus(cooldown));
        if (recent) {
            log.debug("DETECT: {} suppressed for vehicle {} at {} (cooldown {} min)",
                    candidate.getEventType(), vehicleId, occurredAt, cooldown.toMinutes());
            return Optional.empty();
        }

        VehicleEvent saved = vehicleEventRepository.save(VehicleEvent.builder()
                .vehicleId(vehicleId)
                .eventType(candidate.getEventType())
                .severity(candidate.getSeverity())
                .title(candidate.getTitle())
                .description(candidate.getDescription())
                .metadata(candidate.getMetadata())
                .latitude(candidate.getLatitude())
                .longitude(candidate.getLongitude())
                .valueBefore(candidate.getValueBefore())
                .valueAfter(candidate.getValueAfter())
                .threshold(candidate.getThreshold())
                .createdAt(occurredAt)
                .expiresAt(occurredAt.plus(expiryFor(candidate.getEventType())))
                .acknowledged(false)
                .build());
        log.info("DETECT: {} ({}) recorded for vehicle {} at {}",
                saved.getEventType(), saved.getSeverity(), vehicleId, occurredAt);
        return Optional.of(saved);
    }

    /** Events recorded for the sample taken at {@code occurredAt} */
    @Transactional(readOnly = true)
    public List<VehicleEvent> findRecordedAt(String vehicleId, LocalDateTime occurredAt) {
        return vehicleEventRepository.findByVehicleIdAndCreatedAt(vehicleId, occurredAt);
    }

    /**
     * Removes an event whose triggering comparison no longer holds. Callers hold
     * the (vehicle, type) lock, as for inserts.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void retract(VehicleEvent event) {
        vehicleEventRepository.deleteById(event.getId());
        log.info("DETECT: {} #{} retracted for vehicle {} at {}",
                event.getEventType(), event.getId(), event.getVehicleId(), event.getCreatedAt());
    }

    Duration cooldownFor(EventType type) {
        return Duration.ofMinutes(type == EventType.VEHICLE_MOVING ? movingCooldownMinutes : cooldownMinutes);
    }

    Duration expiryFor(EventType type) {
        switch (type) {
            case IGNITION_ON:
            case IGNITION_OFF:
                return Duration.ofHours(ignitionExpiryHours);
            case TRIP_COMPLETED:
                return Duration.ofHours(tripCompletedExpiryHours);
            case ONLINE:
            case VEHICLE_MOVING:
                return Duration.ofHours(shortLivedExpiryHours);
            default:
                return Duration.ofHours(defaultExpiryHours);
        }
    }
}
