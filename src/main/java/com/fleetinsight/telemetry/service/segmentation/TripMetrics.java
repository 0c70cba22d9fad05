package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.DistanceMethod;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.TripSource;
import com.fleetinsight.telemetry.util.GeoUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Turns a closed segment into a Trip with distance and speed aggregates.
 *
 * Distance precedence:
 *  1. odometer delta between first and last sample, when positive
 *  2. sum of great-circle hops, skipping hops longer than max-segment-km (GPS jumps)
 *
 * A segment is dropped when end time does not exceed start time, or when the
 * great-circle fallback yields less than min-distance-km.
 */
@Component
public class TripMetrics {

    private final double minDistanceKm;
    private final double maxSegmentKm;
    private final double maxValidSpeedKmh;

    public TripMetrics(@Value("${telemetry.trips.min-distance-km:0.05}") double minDistanceKm,
                       @Value("${telemetry.trips.max-segment-km:10}") double maxSegmentKm,
                       @Value("${telemetry.trips.max-valid-speed-kmh:200}") double maxValidSpeedKmh) {
        this.minDistanceKm = minDistanceKm;
        this.maxSegmentKm = maxSegmentKm;
        this.maxValidSpeedKmh = maxValidSpeedKmh;
    }

    public Optional<Trip> toTrip(String vehicleId, TripSource source, TripSegment segment) {
        PositionSample first = segment.first();
        PositionSample last = segment.last();

        if (!last.getTimestamp().isAfter(first.getTimestamp())) {
            return Optional.empty();
        }

        double distanceKm;
        DistanceMethod method;
        Double odometerKm = odometerDeltaKm(first, last);
        if (odometerKm != null) {
            distanceKm = odometerKm;
            method = DistanceMethod.ODOMETER;
        } else {
            distanceKm = greatCircleKm(segment.getSamples());
            method = DistanceMethod.GREAT_CIRCLE;
            if (distanceKm < minDistanceKm) {
                return Optional.empty();
            }
        }

        double maxSpeed = 0.0;
        double speedSum = 0.0;
        int speedCount = 0;
        for (PositionSample s : segment.getSamples()) {
            Double speed = s.getSpeed();
            if (speed != null && speed > 0 && speed < maxValidSpeedKmh) {
                maxSpeed = Math.max(maxSpeed, speed);
                speedSum += speed;
                speedCount++;
            }
        }

        return Optional.of(Trip.builder()
                .vehicleId(vehicleId)
                .sourceMethod(source)
                .startTime(first.getTimestamp())
                .endTime(last.getTimestamp())
                .startLatitude(first.getLatitude())
                .startLongitude(first.getLongitude())
                .endLatitude(last.getLatitude())
                .endLongitude(last.getLongitude())
                .distanceKm(round3(distanceKm))
                .distanceMethod(method)
                .maxSpeed(round3(maxSpeed))
                .avgSpeed(speedCount > 0 ? round3(speedSum / speedCount) : 0.0)
                .durationSeconds(Duration.between(first.getTimestamp(), last.getTimestamp()).getSeconds())
                .sampleCount(segment.getSamples().size())
                .build());
    }

    /** Odometer delta in km, or null when either reading is missing or the delta is not positive */
    Double odometerDeltaKm(PositionSample first, PositionSample last) {
        if (first.getOdometerTotal() == null || last.getOdometerTotal() == null) {
            return null;
        }
        double deltaMeters = last.getOdometerTotal() - first.getOdometerTotal();
        return deltaMeters > 0 ? deltaMeters / 1000.0 : null;
    }

    double greatCircleKm(List<PositionSample> samples) {
        double total = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            PositionSample a = samples.get(i - 1);
            PositionSample b = samples.get(i);
            double hop = GeoUtil.distanceKm(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
            if (hop <= maxSegmentKm) {
                total += hop;
            }
        }
        return total;
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
