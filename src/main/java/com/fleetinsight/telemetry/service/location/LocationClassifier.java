package com.fleetinsight.telemetry.service.location;

import com.fleetinsight.telemetry.entity.LearnedLocation;
import com.fleetinsight.telemetry.entity.LocationType;
import com.fleetinsight.telemetry.entity.LocationVisitPattern;
import com.fleetinsight.telemetry.entity.TimeOfDay;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Assigns a purpose to a learned location.
 *
 * Order of checks:
 *  1. strong morning AND strong evening pattern → FREQUENT (twice-daily errand stop)
 *  2. more than 70% of nearby samples between 22:00 and 06:59, with 10+ visits → HOME
 *  3. mean sample hour within 08..18, with 15+ visits → WORK
 *  4. mean dwell under 30 minutes → PARKING
 *  5. otherwise FREQUENT
 *
 * Confidence grows linearly with visits and reaches 1.0 at 20.
 */
@Component
public class LocationClassifier {

    static final int MIN_VISITS = 3;
    static final int HOME_MIN_VISITS = 10;
    static final int WORK_MIN_VISITS = 15;
    static final double OVERNIGHT_FRACTION = 0.7;
    static final long PARKING_MAX_DWELL_MINUTES = 30;
    static final int STRONG_PATTERN_MIN_VISITS = 3;
    static final double STRONG_PATTERN_SHARE = 0.3;
    static final double FULL_CONFIDENCE_VISITS = 20.0;

    @Getter
    @AllArgsConstructor
    public static class Classification {
        private final LocationType type;
        private final Integer typicalArrivalHour;
        private final double confidence;
    }

    public boolean canClassify(LearnedLocation location) {
        return location.isAutoDetected() && location.getVisitCount() >= MIN_VISITS;
    }

    /**
     * @param patterns        the location's time-of-day buckets
     * @param nearbySampleTimes times of recent samples inside the location radius
     */
    public Classification classify(LearnedLocation location,
                                   List<LocationVisitPattern> patterns,
                                   List<LocalDateTime> nearbySampleTimes) {
        int visits = location.getVisitCount();
        double confidence = Math.min(visits / FULL_CONFIDENCE_VISITS, 1.0);

        Integer typicalHour = null;
        double overnightFraction = 0.0;
        if (!nearbySampleTimes.isEmpty()) {
            long overnight = nearbySampleTimes.stream().filter(t -> isOvernight(t.getHour())).count();
            overnightFraction = (double) overnight / nearbySampleTimes.size();
            double meanHour = nearbySampleTimes.stream().mapToInt(LocalDateTime::getHour).average().orElse(0);
            typicalHour = (int) Math.round(meanHour);
        }

        LocationType type;
        if (isStrong(patterns, TimeOfDay.MORNING, visits) && isStrong(patterns, TimeOfDay.EVENING, visits)) {
            type = LocationType.FREQUENT;
        } else if (overnightFraction > OVERNIGHT_FRACTION && visits >= HOME_MIN_VISITS) {
            type = LocationType.HOME;
        } else if (typicalHour != null && typicalHour >= 8 && typicalHour <= 18 && visits >= WORK_MIN_VISITS) {
            type = LocationType.WORK;
        } else if (location.getTotalDurationMinutes() / visits < PARKING_MAX_DWELL_MINUTES) {
            type = LocationType.PARKING;
        } else {
            type = LocationType.FREQUENT;
        }
        return new Classification(type, typicalHour, confidence);
    }

    static boolean isOvernight(int hour) {
        return hour >= 22 || hour <= 6;
    }

    private boolean isStrong(List<LocationVisitPattern> patterns, TimeOfDay bucket, int totalVisits) {
        return patterns.stream()
                .filter(p -> p.getTimeBucket() == bucket)
                .anyMatch(p -> p.getVisitCount() >= STRONG_PATTERN_MIN_VISITS
                        && p.getVisitCount() >= STRONG_PATTERN_SHARE * totalVisits);
    }
}
