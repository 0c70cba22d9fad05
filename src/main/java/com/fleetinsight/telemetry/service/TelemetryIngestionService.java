package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.dto.IngestionResult;
import com.fleetinsight.telemetry.dto.PositionSampleRequest;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.exception.InvalidSampleException;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Entry point of the pipeline for one sample.
 *
 * Steps (under a per-vehicle lock, so one vehicle's samples run one at a time):
 * 1. Validate; a bad sample is rejected on its own
 * 2. Dedupe on (vehicle, timestamp) and store
 * 3. Event detection against the previous sample; for a late sample, the
 *    stored successor is re-evaluated against it as well
 * 4. Mark the sample evaluated
 * 5. Parking session tracking (in-order samples only)
 * 6. Incremental trip segmentation
 *
 * Not transactional itself: the stored sample is committed before the later
 * stages read it, and each stage commits on its own. If detection fails the
 * sample stays unevaluated and a redelivery runs it again instead of being
 * dropped as a duplicate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryIngestionService {

    private final PositionSampleRepository positionSampleRepository;
    private final EventDetectionService eventDetectionService;
    private final ParkingSessionService parkingSessionService;
    private final TripSegmentationService tripSegmentationService;
    private final Validator validator;

    private final Cache<String, ReentrantLock> vehicleLocks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public IngestionResult ingest(PositionSampleRequest request) {
        validate(request);

        ReentrantLock lock = vehicleLocks.get(request.getVehicleId(), k -> new ReentrantLock());
        lock.lock();
        try {
            return ingestLocked(request);
        } finally {
            lock.unlock();
        }
    }

    private IngestionResult ingestLocked(PositionSampleRequest request) {
        String vehicleId = request.getVehicleId();

        PositionSample sample;
        Optional<PositionSample> stored = positionSampleRepository.findByVehicleIdAndTimestamp(vehicleId, request.getTimestamp());
        if (stored.isPresent()) {
            if (stored.get().isEvaluated()) {
                log.debug("INGEST: duplicate sample for vehicle {} at {} ignored", vehicleId, request.getTimestamp());
                return IngestionResult.duplicate(vehicleId, request.getTimestamp());
            }
            log.info("INGEST: sample for vehicle {} at {} stored but never evaluated, resuming detection",
                    vehicleId, request.getTimestamp());
            sample = stored.get();
        } else {
            try {
                sample = positionSampleRepository.save(toSample(request));
            } catch (DataIntegrityViolationException e) {
                // another node stored the same (vehicle, timestamp) first
                log.debug("INGEST: concurrent duplicate for vehicle {} at {} ignored", vehicleId, request.getTimestamp());
                return IngestionResult.duplicate(vehicleId, request.getTimestamp());
            }
        }

        boolean late = positionSampleRepository.existsByVehicleIdAndTimestampAfter(vehicleId, sample.getTimestamp());
        if (late) {
            log.info("INGEST: late sample for vehicle {} at {} — successor re-evaluated, trips replayed",
                    vehicleId, sample.getTimestamp());
        }

        DetectionResult detection = eventDetectionService.detect(sample);
        List<VehicleEvent> events = new ArrayList<>(detection.getEvents());
        if (late) {
            events.addAll(eventDetectionService.reevaluateSuccessor(sample));
        }

        sample.setEvaluated(true);
        sample = positionSampleRepository.save(sample);

        if (!late) {
            try {
                parkingSessionService.onSample(detection.getPrevious(), sample);
            } catch (RuntimeException e) {
                log.error("INGEST: parking tracking failed for vehicle {} at {} — {}",
                        vehicleId, sample.getTimestamp(), e.getMessage());
            }
        }

        List<Trip> trips = List.of();
        try {
            trips = tripSegmentationService.onSample(sample);
        } catch (RuntimeException e) {
            log.error("INGEST: trip segmentation failed for vehicle {} at {} — {}",
                    vehicleId, sample.getTimestamp(), e.getMessage());
        }

        log.debug("INGEST: sample #{} stored for vehicle {} at {} — events: {}, trips written: {}",
                sample.getId(), vehicleId, sample.getTimestamp(), events.size(), trips.size());

        return IngestionResult.builder()
                .status(IngestionResult.Status.STORED)
                .vehicleId(vehicleId)
                .timestamp(sample.getTimestamp())
                .sampleId(sample.getId())
                .late(late)
                .events(events.stream().map(VehicleEvent::getEventType).toList())
                .tripsWritten(trips.size())
                .build();
    }

    void validate(PositionSampleRequest request) {
        if (request == null) {
            throw new InvalidSampleException("Sample is required");
        }
        Set<ConstraintViolation<PositionSampleRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidSampleException("Invalid sample for vehicle " + request.getVehicleId() + " — " + message);
        }
    }

    private PositionSample toSample(PositionSampleRequest request) {
        return PositionSample.builder()
                .vehicleId(request.getVehicleId())
                .timestamp(request.getTimestamp())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .speed(request.getSpeed())
                .ignitionOn(request.getIgnitionOn())
                .batteryPercent(request.getBatteryPercent())
                .odometerTotal(request.getOdometerTotal())
                .online(request.getOnline())
                .build();
    }
}
