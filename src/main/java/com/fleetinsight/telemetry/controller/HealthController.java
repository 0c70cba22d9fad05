package com.fleetinsight.telemetry.controller;

import com.fleetinsight.telemetry.dto.ApiResponse;
import com.fleetinsight.telemetry.dto.HealthBatchResult;
import com.fleetinsight.telemetry.entity.DailyHealthScore;
import com.fleetinsight.telemetry.service.HealthScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily health interface. The scheduler that calls /compute every night lives outside this service.
 *
 *  GET  /api/health/vehicle/{vehicleId}?from&to
 *  POST /api/health/compute?date : sweep every active vehicle
 *  POST /api/health/vehicle/{vehicleId}/recompute?date&daysBack
 *  POST /api/health/vehicle/{vehicleId}/backfill?days&endDate
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final HealthScoringService healthScoringService;

    @GetMapping("/vehicle/{vehicleId}")
    public ResponseEntity<ApiResponse> getScores(
            @PathVariable String vehicleId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        List<DailyHealthScore> scores = healthScoringService.findScores(vehicleId, from, to);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(scores),
                "Found " + scores.size() + " daily score(s) for vehicle " + vehicleId));
    }

    /** Defaults to yesterday */
    @PostMapping("/compute")
    public ResponseEntity<ApiResponse> computeAll(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now().minusDays(1);
        HealthBatchResult result = healthScoringService.computeAllForDay(day);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Health computed for " + result.getSucceeded() + "/" + result.getTotal() + " vehicle(s)"));
    }

    @PostMapping("/vehicle/{vehicleId}/recompute")
    public ResponseEntity<ApiResponse> recompute(
            @PathVariable String vehicleId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) Integer daysBack) {
        LocalDate end = date != null ? date : LocalDate.now();
        List<DailyHealthScore> scores = healthScoringService.recomputeRecentWindow(vehicleId, end, daysBack);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(scores),
                "Recomputed " + scores.size() + " day(s) for vehicle " + vehicleId));
    }

    @PostMapping("/vehicle/{vehicleId}/backfill")
    public ResponseEntity<ApiResponse> backfill(
            @PathVariable String vehicleId,
            @RequestParam(defaultValue = "7") int days,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        LocalDate end = endDate != null ? endDate : LocalDate.now().minusDays(1);
        List<DailyHealthScore> scores = healthScoringService.backfill(vehicleId, end, days);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(scores),
                "Backfilled " + scores.size() + " day(s) for vehicle " + vehicleId));
    }

    private List<Map<String, Object>> toResponseList(List<DailyHealthScore> scores) {
        return scores.stream().map(s -> {
            Map<String, Object> components = new LinkedHashMap<>();
            components.put("connectivity", s.getConnectivityScore());
            components.put("safety",       s.getSafetyScore());
            components.put("utilization",  s.getUtilizationScore());
            components.put("dataQuality",  s.getDataQualityScore());

            Map<String, Object> m = new LinkedHashMap<>();
            m.put("vehicleId",       s.getVehicleId());
            m.put("date",            s.getScoreDate().toString());
            m.put("healthScore",     s.getHealthScore());
            m.put("confidenceScore", s.getConfidenceScore());
            m.put("trend",           s.getTrend().name());
            m.put("previousScore",   s.getPreviousScore());
            m.put("components",      components);
            m.put("modelVersion",    s.getModelVersion());
            return m;
        }).toList();
    }
}
