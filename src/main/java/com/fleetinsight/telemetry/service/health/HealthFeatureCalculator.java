package com.fleetinsight.telemetry.service.health;

import com.fleetinsight.telemetry.entity.DailyHealthFeature;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.util.GeoUtil;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates one vehicle-day into a DailyHealthFeature.
 *
 * Pure: output depends only on the arguments. computedAt is left for the writer.
 */
@Component
public class HealthFeatureCalculator {

    static final double SPEEDING_KMH = 100.0;
    static final double IMPOSSIBLE_SPEED_KMH = 220.0;
    static final double IMPOSSIBLE_MIN_DISTANCE_KM = 1.0;
    static final double DRIFT_MAX_SPEED_KMH = 3.0;
    static final double DRIFT_MIN_DISTANCE_KM = 0.2;
    static final long DRIFT_MAX_GAP_SECONDS = 600;
    static final int LOW_SAMPLE_POINTS = 24;
    static final double DEFAULT_EXPECTED_POINTS = 288.0;
    static final double MIN_EXPECTED_POINTS = 24.0;
    static final double MAX_EXPECTED_POINTS = 1440.0;

    public DailyHealthFeature calculate(String vehicleId, LocalDate date,
                                        List<PositionSample> samples,
                                        List<Trip> trips,
                                        List<VehicleEvent> events) {
        List<PositionSample> ordered = samples.stream()
                .sorted(Comparator.comparing(PositionSample::getTimestamp))
                .toList();

        DailyHealthFeature feature = DailyHealthFeature.builder()
                .vehicleId(vehicleId)
                .scoreDate(date)
                .build();

        applySampleStats(feature, ordered);
        applyTripStats(feature, trips);
        applyEventStats(feature, events);
        return feature;
    }

    private void applySampleStats(DailyHealthFeature feature, List<PositionSample> samples) {
        int points = samples.size();
        int transitions = 0;
        int jumps = 0;
        int driftPoints = 0;
        int speeding = 0;
        double gapSum = 0.0;
        double maxGap = 0.0;

        for (int i = 0; i < samples.size(); i++) {
            PositionSample current = samples.get(i);
            if (current.getSpeed() != null && current.getSpeed() > SPEEDING_KMH) {
                speeding++;
            }
            if (i == 0) {
                continue;
            }
            PositionSample previous = samples.get(i - 1);
            transitions++;

            long seconds = Duration.between(previous.getTimestamp(), current.getTimestamp()).getSeconds();
            double gapMinutes = seconds / 60.0;
            gapSum += gapMinutes;
            maxGap = Math.max(maxGap, gapMinutes);

            double km = GeoUtil.distanceKm(previous.getLatitude(), previous.getLongitude(),
                    current.getLatitude(), current.getLongitude());
            if (seconds > 0 && km / (seconds / 3600.0) > IMPOSSIBLE_SPEED_KMH && km > IMPOSSIBLE_MIN_DISTANCE_KM) {
                jumps++;
            }
            if (current.speedOrZero() < DRIFT_MAX_SPEED_KMH && km > DRIFT_MIN_DISTANCE_KM
                    && seconds <= DRIFT_MAX_GAP_SECONDS) {
                driftPoints++;
            }
        }

        Double avgInterval = transitions > 0 ? gapSum / transitions : null;
        double expected = avgInterval != null && avgInterval > 0
                ? clamp(1440.0 / avgInterval, MIN_EXPECTED_POINTS, MAX_EXPECTED_POINTS)
                : DEFAULT_EXPECTED_POINTS;

        feature.setPointsCount(points);
        feature.setTransitionCount(transitions);
        feature.setAvgSamplingIntervalMinutes(avgInterval);
        feature.setMaxGapMinutes(maxGap);
        feature.setImpossibleJumpCount(jumps);
        feature.setGpsDriftRatio(transitions > 0 ? (double) driftPoints / transitions : 0.0);
        feature.setSpeedingExposurePct(points > 0 ? speeding * 100.0 / points : 0.0);
        feature.setLowSampleDay(points < LOW_SAMPLE_POINTS);
        feature.setExpectedPoints(expected);
        feature.setDataCompletenessPct(clamp(points * 100.0 / expected, 0.0, 100.0));

        List<Integer> battery = samples.stream()
                .map(PositionSample::getBatteryPercent)
                .filter(Objects::nonNull)
                .toList();
        feature.setAvgBatteryPercent(battery.isEmpty() ? null
                : battery.stream().mapToInt(Integer::intValue).average().orElse(0));
        feature.setMinBatteryPercent(battery.isEmpty() ? null
                : battery.stream().mapToInt(Integer::intValue).min().orElse(0));
    }

    private void applyTripStats(DailyHealthFeature feature, List<Trip> trips) {
        feature.setTripCount(trips.size());
        feature.setDistanceKm(trips.stream()
                .map(Trip::getDistanceKm).filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue).sum());
        feature.setMovingMinutes(trips.stream()
                .map(Trip::getDurationSeconds).filter(Objects::nonNull)
                .mapToLong(Long::longValue).sum() / 60.0);
    }

    private void applyEventStats(DailyHealthFeature feature, List<VehicleEvent> events) {
        List<VehicleEvent> idle = events.stream().filter(e -> e.getEventType() == EventType.IDLE_TOO_LONG).toList();
        feature.setIdleEventCount(idle.size());
        feature.setIdleMinutes(idle.stream()
                .map(e -> e.getMetadata() != null ? e.getMetadata().get("idle_minutes") : null)
                .filter(v -> v instanceof Number)
                .mapToDouble(v -> ((Number) v).doubleValue())
                .average()
                .orElse(0.0));
        feature.setOverspeedEventCount(count(events, EventType.OVERSPEEDING));
        feature.setHarshEventCount(count(events, EventType.HARSH_BRAKING) + count(events, EventType.RAPID_ACCELERATION));
        feature.setOfflineEventCount(count(events, EventType.OFFLINE));
    }

    private static int count(List<VehicleEvent> events, EventType type) {
        return (int) events.stream().filter(e -> e.getEventType() == type).count();
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
