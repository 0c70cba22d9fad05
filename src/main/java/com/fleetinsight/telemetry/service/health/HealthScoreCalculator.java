package com.fleetinsight.telemetry.service.health;

import com.fleetinsight.telemetry.entity.DailyHealthFeature;
import com.fleetinsight.telemetry.entity.DailyHealthScore;
import com.fleetinsight.telemetry.entity.HealthTrend;
import org.springframework.stereotype.Component;

/**
 * Daily health model "daily-gps-health-v1".
 *
 * Component scores start at 100 and lose a capped penalty:
 *
 *   connectivity  offline × 8 + max(maxGap − 30, 0) × 0.25                         cap 70
 *   safety        harsh × 4 + overspeed × 3 + speeding% × 0.5                       cap 75
 *   utilization   idleMin × 0.15 + idleEvents × 2 + max(km − 400, 0) × 0.05         cap 65
 *   data quality  jumps × 12 + drift × 70 + (low sample ? 20 : 0)
 *                 + (100 − completeness) × 0.5                                      cap 85
 *
 * Health is 0.35 / 0.30 / 0.20 / 0.15 of the components, minus flat penalties
 * for a 4h+ gap (10), three or more jumps (15) and 20%+ speeding (10), and is
 * capped at 75 below confidence 35 and at 85 below confidence 50.
 */
@Component
public class HealthScoreCalculator {

    public static final String MODEL_VERSION = "daily-gps-health-v1";

    static final int TREND_BAND = 8;
    static final int CRITICAL_BELOW = 40;

    public DailyHealthScore score(DailyHealthFeature f, Integer previousScore) {
        int connectivity = component(f.getOfflineEventCount() * 8
                + Math.max(f.getMaxGapMinutes() - 30, 0) * 0.25, 70);
        int safety = component(f.getHarshEventCount() * 4
                + f.getOverspeedEventCount() * 3
                + f.getSpeedingExposurePct() * 0.5, 75);
        int utilization = component(f.getIdleMinutes() * 0.15
                + f.getIdleEventCount() * 2
                + Math.max(f.getDistanceKm() - 400, 0) * 0.05, 65);
        int dataQuality = component(f.getImpossibleJumpCount() * 12
                + f.getGpsDriftRatio() * 100 * 0.7
                + (f.isLowSampleDay() ? 20 : 0)
                + (100 - f.getDataCompletenessPct()) * 0.5, 85);

        double raw = 0.35 * connectivity + 0.30 * safety + 0.20 * utilization + 0.15 * dataQuality;
        if (f.getMaxGapMinutes() >= 240) {
            raw -= 10;
        }
        if (f.getImpossibleJumpCount() >= 3) {
            raw -= 15;
        }
        if (f.getSpeedingExposurePct() >= 20) {
            raw -= 10;
        }
        int health = clamp((int) Math.round(raw));

        double anomalyPenalty = Math.min(100, f.getImpossibleJumpCount() * 15 + f.getGpsDriftRatio() * 100 * 40);
        int confidence = clamp((int) Math.round(f.getDataCompletenessPct() * 0.7 + (100 - anomalyPenalty) * 0.3));

        if (confidence < 35) {
            health = Math.min(health, 75);
        } else if (confidence < 50) {
            health = Math.min(health, 85);
        }

        return DailyHealthScore.builder()
                .vehicleId(f.getVehicleId())
                .scoreDate(f.getScoreDate())
                .healthScore(health)
                .confidenceScore(confidence)
                .trend(trend(health, previousScore))
                .connectivityScore(connectivity)
                .safetyScore(safety)
                .utilizationScore(utilization)
                .dataQualityScore(dataQuality)
                .previousScore(previousScore)
                .modelVersion(MODEL_VERSION)
                .build();
    }

    static HealthTrend trend(int health, Integer previousScore) {
        if (health < CRITICAL_BELOW) {
            return HealthTrend.CRITICAL;
        }
        if (previousScore == null) {
            return HealthTrend.STABLE;
        }
        int diff = health - previousScore;
        if (diff >= TREND_BAND) {
            return HealthTrend.IMPROVING;
        }
        if (diff <= -TREND_BAND) {
            return HealthTrend.DECLINING;
        }
        return HealthTrend.STABLE;
    }

    private static int component(double penalty, double cap) {
        // half-up like a numeric cast to INTEGER
        return Math.max(0, 100 - (int) Math.round(Math.min(cap, penalty)));
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
