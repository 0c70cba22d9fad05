package com.fleetinsight.telemetry.controller;

import com.fleetinsight.telemetry.dto.ApiResponse;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.TripSource;
import com.fleetinsight.telemetry.service.TripSegmentationService;
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
 * Trip read interface. Both segmentation views are exposed, tagged by sourceMethod.
 *
 *  GET  /api/trips/vehicle/{vehicleId}?from&to&source
 *  POST /api/trips/vehicle/{vehicleId}/resegment?from&to
 */
@RestController
@RequestMapping("/api/trips")
@RequiredArgsConstructor
@Slf4j
public class TripController {

    private final TripSegmentationService tripSegmentationService;

    @GetMapping("/vehicle/{vehicleId}")
    public ResponseEntity<ApiResponse> getTrips(
            @PathVariable String vehicleId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(required = false) TripSource source) {

        if (from.isAfter(to)) {
            return ResponseEntity.badRequest().body(ApiResponse.error(
                    "'from' must not be after 'to'. Received: from=" + from + ", to=" + to));
        }
        List<Trip> trips = tripSegmentationService.findTrips(vehicleId, from, to, source);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(trips),
                "Found " + trips.size() + " trip(s) for vehicle " + vehicleId));
    }

    /**
     * Re-derives trips starting in [from, to] from the stored samples, e.g. after
     * late telemetry was loaded or a threshold changed.
     */
    @PostMapping("/vehicle/{vehicleId}/resegment")
    public ResponseEntity<ApiResponse> resegment(
            @PathVariable String vehicleId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        log.info("Resegment requested for vehicle {} [{} .. {}]", vehicleId, from, to);
        List<Trip> trips = tripSegmentationService.resegment(vehicleId, from, to);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(trips),
                "Resegmented: " + trips.size() + " trip(s)"));
    }

    private List<Map<String, Object>> toResponseList(List<Trip> trips) {
        return trips.stream().map(t -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",              t.getId());
            m.put("vehicleId",       t.getVehicleId());
            m.put("sourceMethod",    t.getSourceMethod().name());
            m.put("startTime",       t.getStartTime().toString());
            m.put("endTime",         t.getEndTime().toString());
            m.put("startLatitude",   t.getStartLatitude());
            m.put("startLongitude",  t.getStartLongitude());
            m.put("endLatitude",     t.getEndLatitude());
            m.put("endLongitude",    t.getEndLongitude());
            m.put("distanceKm",      t.getDistanceKm());
            m.put("distanceMethod",  t.getDistanceMethod() != null ? t.getDistanceMethod().name() : null);
            m.put("maxSpeed",        t.getMaxSpeed());
            m.put("avgSpeed",        t.getAvgSpeed());
            m.put("durationSeconds", t.getDurationSeconds());
            m.put("sampleCount",     t.getSampleCount());
            return m;
        }).toList();
    }
}
