package com.fleetinsight.telemetry.controller;

import com.fleetinsight.telemetry.dto.ApiResponse;
import com.fleetinsight.telemetry.dto.LocationLabelRequest;
import com.fleetinsight.telemetry.dto.NearbyLocation;
import com.fleetinsight.telemetry.entity.LearnedLocation;
import com.fleetinsight.telemetry.service.LocationClusteringService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learned location read interface.
 *
 *  GET  /api/locations/vehicle/{vehicleId} : ranked by visit count
 *  GET  /api/locations/nearby?lat&lon&radius&vehicleId
 *  PUT  /api/locations/{locationId}/label : manual type/label
 *  POST /api/locations/vehicle/{vehicleId}/learn?days : replay history
 */
@RestController
@RequestMapping("/api/locations")
@RequiredArgsConstructor
@Slf4j
public class LearnedLocationController {

    private final LocationClusteringService locationClusteringService;

    @GetMapping("/vehicle/{vehicleId}")
    public ResponseEntity<ApiResponse> getLocations(@PathVariable String vehicleId) {
        List<LearnedLocation> locations = locationClusteringService.rankedLocations(vehicleId);
        return ResponseEntity.ok(ApiResponse.success(
                locations.stream().map(this::toResponse).toList(),
                "Found " + locations.size() + " learned location(s) for vehicle " + vehicleId));
    }

    /**
     * "Am I at a known place": learned locations within {@code radius} meters, nearest first.
     */
    @GetMapping("/nearby")
    public ResponseEntity<ApiResponse> nearby(@RequestParam double lat,
                                              @RequestParam double lon,
                                              @RequestParam(required = false) Double radius,
                                              @RequestParam(required = false) String vehicleId) {
        List<NearbyLocation> matches = locationClusteringService.findNearby(lat, lon, radius, vehicleId);
        List<Map<String, Object>> body = matches.stream().map(n -> {
            Map<String, Object> m = toResponse(n.getLocation());
            m.put("distanceMeters", Math.round(n.getDistanceMeters() * 10.0) / 10.0);
            return m;
        }).toList();
        return ResponseEntity.ok(ApiResponse.success(body, "Found " + matches.size() + " nearby location(s)"));
    }

    @PutMapping("/{locationId}/label")
    public ResponseEntity<ApiResponse> label(@PathVariable Long locationId,
                                             @Valid @RequestBody LocationLabelRequest request) {
        LearnedLocation location = locationClusteringService.labelLocation(locationId, request);
        return ResponseEntity.ok(ApiResponse.success(toResponse(location), "Location #" + locationId + " labelled"));
    }

    @PostMapping("/vehicle/{vehicleId}/learn")
    public ResponseEntity<ApiResponse> learn(@PathVariable String vehicleId,
                                             @RequestParam(defaultValue = "30") int days) {
        Map<String, Object> summary = locationClusteringService.learnFromHistory(vehicleId, days);
        return ResponseEntity.ok(ApiResponse.success(summary,
                "Learned " + summary.get("learned") + " visit(s) from " + days + " day(s) of history"));
    }

    private Map<String, Object> toResponse(LearnedLocation l) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",                     l.getId());
        m.put("vehicleId",              l.getVehicleId());
        m.put("latitude",               l.getLatitude());
        m.put("longitude",              l.getLongitude());
        m.put("radiusMeters",           l.getRadiusMeters());
        m.put("locationType",           l.getLocationType().name());
        m.put("customLabel",            l.getCustomLabel());
        m.put("visitCount",             l.getVisitCount());
        m.put("totalDurationMinutes",   l.getTotalDurationMinutes());
        m.put("typicalArrivalHour",     l.getTypicalArrivalHour());
        m.put("typicalDurationMinutes", l.getTypicalDurationMinutes());
        m.put("confidence",             l.getConfidence());
        m.put("autoDetected",           l.isAutoDetected());
        m.put("firstVisit",             l.getFirstVisit() != null ? l.getFirstVisit().toString() : null);
        m.put("lastVisit",              l.getLastVisit() != null ? l.getLastVisit().toString() : null);
        return m;
    }
}
