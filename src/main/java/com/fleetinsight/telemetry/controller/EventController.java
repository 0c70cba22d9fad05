package com.fleetinsight.telemetry.controller;

import com.fleetinsight.telemetry.dto.ApiResponse;
import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.service.EventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event read interface.
 *
 *  GET  /api/events/vehicle/{vehicleId} : filtered timeline, newest first
 *  POST /api/events/{eventId}/acknowledge : idempotent acknowledgement
 *  GET  /api/events/vehicle/{vehicleId}/stats : counts by type and severity
 *  POST /api/events/retention/purge : apply the retention policy now
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventController {

    private final EventService eventService;

    /**
     * GET /api/events/vehicle/V-1?acknowledged=false&severity=CRITICAL&from=2026-02-23T06:00:00
     *
     * Every filter is optional.
     */
    @GetMapping("/vehicle/{vehicleId}")
    public ResponseEntity<ApiResponse> getEvents(
            @PathVariable String vehicleId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(required = false) EventSeverity severity,
            @RequestParam(required = false) EventType type) {

        if (from != null && to != null && from.isAfter(to)) {
            return ResponseEntity.badRequest().body(ApiResponse.error(
                    "'from' must not be after 'to'. Received: from=" + from + ", to=" + to));
        }
        List<VehicleEvent> events = eventService.search(vehicleId, from, to, acknowledged, severity, type);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " event(s) for vehicle " + vehicleId));
    }

    @PostMapping("/{eventId}/acknowledge")
    public ResponseEntity<ApiResponse> acknowledge(@PathVariable Long eventId) {
        VehicleEvent event = eventService.acknowledge(eventId);
        return ResponseEntity.ok(ApiResponse.success(toResponse(event), "Event #" + eventId + " acknowledged"));
    }

    @GetMapping("/vehicle/{vehicleId}/stats")
    public ResponseEntity<ApiResponse> stats(@PathVariable String vehicleId,
                                             @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(ApiResponse.success(eventService.stats(vehicleId, days),
                "Event statistics for the last " + days + " day(s)"));
    }

    @PostMapping("/retention/purge")
    public ResponseEntity<ApiResponse> purge() {
        Map<String, Integer> result = eventService.purgeRetention(LocalDateTime.now());
        return ResponseEntity.ok(ApiResponse.success(result, "Purged " + result.get("total") + " event(s)"));
    }

    private List<Map<String, Object>> toResponseList(List<VehicleEvent> events) {
        return events.stream().map(this::toResponse).toList();
    }

    /**
     * createdAt is the sample time the event refers to; recordedAt is when the row was written.
     */
    private Map<String, Object> toResponse(VehicleEvent e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",             e.getId());
        m.put("vehicleId",      e.getVehicleId());
        m.put("eventType",      e.getEventType().name());
        m.put("severity",       e.getSeverity().name());
        m.put("title",          e.getTitle());
        m.put("description",    e.getDescription());
        m.put("metadata",       e.getMetadata());
        m.put("latitude",       e.getLatitude());
        m.put("longitude",      e.getLongitude());
        m.put("valueBefore",    e.getValueBefore());
        m.put("valueAfter",     e.getValueAfter());
        m.put("threshold",      e.getThreshold());
        m.put("createdAt",      e.getCreatedAt() != null ? e.getCreatedAt().toString() : null);
        m.put("expiresAt",      e.getExpiresAt() != null ? e.getExpiresAt().toString() : null);
        m.put("acknowledged",   e.isAcknowledged());
        m.put("acknowledgedAt", e.getAcknowledgedAt() != null ? e.getAcknowledgedAt().toString() : null);
        m.put("recordedAt",     e.getRecordedAt() != null ? e.getRecordedAt().toString() : null);
        return m;
    }
}
