package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.exception.ResourceNotFoundException;
import com.fleetinsight.telemetry.repository.VehicleEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read side and lifecycle of recorded events: filtered queries, acknowledgement,
 * per-vehicle statistics and the retention purge.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventService {

    private final VehicleEventRepository vehicleEventRepository;

    @Value("${telemetry.retention.max-age-days:30}")
    private int maxAgeDays;

    @Value("${telemetry.retention.info-days:7}")
    private int infoRetentionDays;

    @Transactional(readOnly = true)
    public List<VehicleEvent> search(String vehicleId, LocalDateTime from, LocalDateTime to,
                                     Boolean acknowledged, EventSeverity severity, EventType eventType) {
        return vehicleEventRepository.search(vehicleId, from, to, acknowledged, severity, eventType);
    }

    /**
     * Idempotent: acknowledging twice keeps the first acknowledgement time.
     */
    @Transactional
    public VehicleEvent acknowledge(Long eventId) {
        VehicleEvent event = vehicleEventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        if (event.isAcknowledged()) {
            log.debug("Event #{} already acknowledged at {}", eventId, event.getAcknowledgedAt());
            return event;
        }
        event.setAcknowledged(true);
        event.setAcknowledgedAt(LocalDateTime.now());
        log.info("Event #{} ({}) acknowledged for vehicle {}", eventId, event.getEventType(), event.getVehicleId());
        return vehicleEventRepository.save(event);
    }

    /**
     * Counts over the last {@code days} days, by type and by severity.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> stats(String vehicleId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        LocalDateTime since = LocalDateTime.now().minusDays(days);
        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> bySeverity = new TreeMap<>();
        long total = 0;
        for (Object[] row : vehicleEventRepository.countByTypeAndSeverity(vehicleId, since)) {
            EventType type = (EventType) row[0];
            EventSeverity severity = (EventSeverity) row[1];
            long count = ((Number) row[2]).longValue();
            byType.merge(type.name(), count, Long::sum);
            bySeverity.merge(severity.name(), count, Long::sum);
            total += count;
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("vehicleId", vehicleId);
        stats.put("days", days);
        stats.put("total", total);
        stats.put("byType", byType);
        stats.put("bySeverity", bySeverity);
        return stats;
    }

    /**
     * Deletes events that are expired and acknowledged, older than max-age-days,
     * or INFO events older than info-days.
     */
    @Transactional
    public Map<String, Integer> purgeRetention(LocalDateTime now) {
        int expired = vehicleEventRepository.deleteExpiredAcknowledged(now);
        int aged = vehicleEventRepository.deleteOlderThan(now.minusDays(maxAgeDays));
        int info = vehicleEventRepository.deleteBySeverityOlderThan(EventSeverity.INFO, now.minusDays(infoRetentionDays));

        log.info("RETENTION: purged {} event(s) — expired+acknowledged: {}, older than {}d: {}, info older than {}d: {}",
                expired + aged + info, expired, maxAgeDays, aged, infoRetentionDays, info);
        Map<String, Integer> result = new LinkedHashMap<>();
        result.put("expiredAcknowledged", expired);
        result.put("aged", aged);
        result.put("info", info);
        result.put("total", expired + aged + info);
        return result;
    }
}
