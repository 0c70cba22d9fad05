package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import com.fleetinsight.telemetry.service.detection.DetectionContext;
import com.fleetinsight.telemetry.service.detection.EventCandidate;
import com.fleetinsight.telemetry.service.detection.EventRecorder;
import com.fleetinsight.telemetry.service.detection.EventRule;
import com.fleetinsight.telemetry.service.detection.SampleHistory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event Detector.
 *
 * For each new sample:
 *  1. Resolve the previous sample of the same vehicle from the last-sample cache,
 *     or from the position store when the cache misses or the sample arrived late
 *  2. Evaluate every rule against (previous, current); a failing rule is logged and skipped
 *  3. Record each candidate under its (vehicle, type) lock, subject to cooldown
 *  4. Push recorded events to the live feed
 *  5. Remember the sample as the vehicle's latest if it is newer than the cached one
 *
 * A late sample also changes the predecessor of the sample stored right after
 * it; {@link #reevaluateSuccessor} brings that sample's events back in line.
 */
@Service
@Slf4j
public class EventDetectionService {

    private final List<EventRule> rules;
    private final EventRecorder eventRecorder;
    private final SampleHistory sampleHistory;
    private final PositionSampleRepository positionSampleRepository;
    private final EventPublisher eventPublisher;

    private final Cache<String, PositionSample> lastSamples = Caffeine.newBuilder()
            .maximumSize(50_000)
            .expireAfterAccess(Duration.ofHours(12))
            .build();

    // weak values: a lock lives while some thread holds or waits on it
    private final Cache<String, ReentrantLock> keyLocks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public EventDetectionService(List<EventRule> rules,
                                 EventRecorder eventRecorder,
                                 SampleHistory sampleHistory,
                                 PositionSampleRepository positionSampleRepository,
                                 EventPublisher eventPublisher) {
        this.rules = rules;
        this.eventRecorder = eventRecorder;
        this.sampleHistory = sampleHistory;
        this.positionSampleRepository = positionSampleRepository;
        this.eventPublisher = eventPublisher;
        log.info("DETECT: {} rule(s) registered", rules.size());
    }

    public DetectionResult detect(PositionSample current) {
        PositionSample previous = resolvePrevious(current);
        if (previous == null) {
            log.debug("DETECT: no prior sample for vehicle {}, transition rules skipped", current.getVehicleId());
        }

        List<VehicleEvent> recorded = new ArrayList<>();
        for (EventCandidate candidate : evaluate(new DetectionContext(previous, current, sampleHistory))) {
            record(current, candidate).ifPresent(recorded::add);
        }

        remember(current);
        recorded.forEach(eventPublisher::publish);
        return new DetectionResult(previous, recorded);
    }

    /**
     * Re-runs the rules for the stored sample that follows {@code late}, now that
     * {@code late} is its predecessor. Events recorded for that sample whose type
     * no longer fires are retracted; newly firing types are recorded under the
     * usual cooldown.
     *
     * @return events added for the successor, empty when there is none
     */
    public List<VehicleEvent> reevaluateSuccessor(PositionSample late) {
        Optional<PositionSample> next = positionSampleRepository
                .findFirstByVehicleIdAndTimestampAfterOrderByTimestampAsc(late.getVehicleId(), late.getTimestamp());
        if (next.isEmpty()) {
            return List.of();
        }
        PositionSample successor = next.get();

        List<EventCandidate> candidates = evaluate(new DetectionContext(late, successor, sampleHistory));
        Set<EventType> firing = EnumSet.noneOf(EventType.class);
        candidates.forEach(c -> firing.add(c.getEventType()));

        Set<EventType> kept = EnumSet.noneOf(EventType.class);
        for (VehicleEvent existing : eventRecorder.findRecordedAt(successor.getVehicleId(), successor.getTimestamp())) {
            if (firing.contains(existing.getEventType())) {
                kept.add(existing.getEventType());
            } else {
                retract(existing);
            }
        }

        List<VehicleEvent> added = new ArrayList<>();
        for (EventCandidate candidate : candidates) {
            if (!kept.contains(candidate.getEventType())) {
                record(successor, candidate).ifPresent(added::add);
            }
        }
        log.info("DETECT: successor of late sample for vehicle {} at {} re-evaluated: kept {}, added {}",
                late.getVehicleId(), successor.getTimestamp(), kept, added.size());
        added.forEach(eventPublisher::publish);
        return added;
    }

    /** Latest sample seen for a vehicle, if any */
    public Optional<PositionSample> lastSample(String vehicleId) {
        PositionSample cached = lastSamples.getIfPresent(vehicleId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<PositionSample> stored = positionSampleRepository.findTopByVehicleIdOrderByTimestampDesc(vehicleId);
        stored.ifPresent(s -> lastSamples.put(vehicleId, s));
        return stored;
    }

    PositionSample resolvePrevious(PositionSample current) {
        PositionSample cached = lastSamples.getIfPresent(current.getVehicleId());
        if (cached != null && cached.getTimestamp().isBefore(current.getTimestamp())) {
            return cached;
        }
        return positionSampleRepository
                .findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(current.getVehicleId(), current.getTimestamp())
                .orElse(null);
    }

    private List<EventCandidate> evaluate(DetectionContext context) {
        List<EventCandidate> candidates = new ArrayList<>();
        for (EventRule rule : rules) {
            try {
                candidates.addAll(rule.evaluate(context));
            } catch (RuntimeException e) {
                log.warn("DETECT: rule {} failed for vehicle {} at {}: {}", rule.name(),
                        context.getCurrent().getVehicleId(), context.getCurrent().getTimestamp(), e.getMessage());
            }
        }
        return candidates;
    }

    private void remember(PositionSample sample) {
        lastSamples.asMap().merge(sample.getVehicleId(), sample,
                (old, candidate) -> candidate.getTimestamp().isAfter(old.getTimestamp()) ? candidate : old);
    }

    private Optional<VehicleEvent> record(PositionSample current, EventCandidate candidate) {
        ReentrantLock lock = lockFor(current.getVehicleId(), candidate.getEventType());
        lock.lock();
        try {
            return eventRecorder.recordIfOutsideCooldown(current.getVehicleId(), current.getTimestamp(), candidate);
        } catch (RuntimeException e) {
            log.error("DETECT: failed to record {} for vehicle {} at {}: {}",
                    candidate.getEventType(), current.getVehicleId(), current.getTimestamp(), e.getMessage());
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private void retract(VehicleEvent event) {
        ReentrantLock lock = lockFor(event.getVehicleId(), event.getEventType());
        lock.lock();
        try {
            eventRecorder.retract(event);
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String vehicleId, EventType type) {
        return keyLocks.get(vehicleId + "|" + type, k -> new ReentrantLock());
    }
}
