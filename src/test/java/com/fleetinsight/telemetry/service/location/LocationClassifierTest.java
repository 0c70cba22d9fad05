package com.fleetinsight.telemetry.service.location;

import com.fleetinsight.telemetry.entity.LearnedLocation;
import com.fleetinsight.telemetry.entity.LocationType;
import com.fleetinsight.telemetry.entity.LocationVisitPattern;
import com.fleetinsight.telemetry.entity.TimeOfDay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LocationClassifier.
 *
 * Test cases:
 *  1. strongMorningAndEvening_frequent
 *  2. mostlyOvernight_home
 *  3. daytimeWithManyVisits_work
 *  4. shortDwells_parking
 *  5. longDwellsFewVisits_frequent
 *  6. canClassify_needsThreeVisitsAndAutoDetection
 *  7. confidence_linearUpToTwentyVisits
 */
class LocationClassifierTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2026, 3, 1, 0, 0);

    private final LocationClassifier classifier = new LocationClassifier();

    private LearnedLocation location(int visits, long totalMinutes) {
        return LearnedLocation.builder()
                .id(1L)
                .vehicleId("V-600")
                .latitude(12.95)
                .longitude(77.60)
                .radiusMeters(50.0)
                .locationType(LocationType.UNKNOWN)
                .visitCount(visits)
                .totalDurationMinutes(totalMinutes)
                .autoDetected(true)
                .build();
    }

    private LocationVisitPattern pattern(TimeOfDay bucket, int visits) {
        return LocationVisitPattern.builder().locationId(1L).timeBucket(bucket).visitCount(visits).build();
    }

    private List<LocalDateTime> timesAtHours(int... hours) {
        List<LocalDateTime> times = new ArrayList<>();
        for (int i = 0; i < hours.length; i++) {
            times.add(DAY.plusDays(i).withHour(hours[i]));
        }
        return times;
    }

    @Test
    @DisplayName("10 morning + 10 evening visits of 20 min → FREQUENT, not PARKING")
    void strongMorningAndEvening_frequent() {
        LocationClassifier.Classification result = classifier.classify(location(20, 400),
                List.of(pattern(TimeOfDay.MORNING, 10), pattern(TimeOfDay.EVENING, 10)),
                timesAtHours(8, 18, 8, 18));

        assertThat(result.getType()).isEqualTo(LocationType.FREQUENT);
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Weak evening bucket → pattern rule does not apply")
    void weakEveningBucket_fallsThrough() {
        LocationClassifier.Classification result = classifier.classify(location(20, 400),
                List.of(pattern(TimeOfDay.MORNING, 18), pattern(TimeOfDay.EVENING, 2)),
                List.of());

        assertThat(result.getType()).isEqualTo(LocationType.PARKING);
    }

    @Test
    @DisplayName("More than 70% of nearby samples overnight with 12 visits → HOME")
    void mostlyOvernight_home() {
        LocationClassifier.Classification result = classifier.classify(location(12, 12 * 600),
                List.of(pattern(TimeOfDay.NIGHT, 12)),
                timesAtHours(23, 1, 3, 5, 6, 22, 0, 2, 12, 19));

        assertThat(result.getType()).isEqualTo(LocationType.HOME);
        assertThat(result.getConfidence()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Overnight but only 9 visits → not HOME")
    void overnightTooFewVisits_notHome() {
        LocationClassifier.Classification result = classifier.classify(location(9, 9 * 600),
                List.of(), timesAtHours(23, 1, 3, 5));

        assertThat(result.getType()).isEqualTo(LocationType.FREQUENT);
    }

    @Test
    @DisplayName("Mean sample hour 12 with 16 long visits → WORK")
    void daytimeWithManyVisits_work() {
        LocationClassifier.Classification result = classifier.classify(location(16, 16 * 480),
                List.of(pattern(TimeOfDay.MORNING, 16)),
                timesAtHours(9, 10, 12, 14, 15));

        assertThat(result.getType()).isEqualTo(LocationType.WORK);
        assertThat(result.getTypicalArrivalHour()).isEqualTo(12);
    }

    @Test
    @DisplayName("Mean dwell 20 min → PARKING")
    void shortDwells_parking() {
        assertThat(classifier.classify(location(5, 100), List.of(), List.of()).getType())
                .isEqualTo(LocationType.PARKING);
    }

    @Test
    @DisplayName("Mean dwell 60 min, no other signal → FREQUENT")
    void longDwellsFewVisits_frequent() {
        LocationClassifier.Classification result = classifier.classify(location(5, 300), List.of(), List.of());

        assertThat(result.getType()).isEqualTo(LocationType.FREQUENT);
        assertThat(result.getTypicalArrivalHour()).isNull();
    }

    @Test
    @DisplayName("Fewer than 3 visits or a manual label → not classifiable")
    void canClassify_needsThreeVisitsAndAutoDetection() {
        LearnedLocation manual = location(10, 100);
        manual.setAutoDetected(false);

        assertThat(classifier.canClassify(location(2, 100))).isFalse();
        assertThat(classifier.canClassify(location(3, 100))).isTrue();
        assertThat(classifier.canClassify(manual)).isFalse();
    }

    @Test
    @DisplayName("Confidence = visits / 20, capped at 1")
    void confidence_linearUpToTwentyVisits() {
        assertThat(classifier.classify(location(5, 300), List.of(), List.of()).getConfidence()).isEqualTo(0.25);
        assertThat(classifier.classify(location(40, 2400), List.of(), List.of()).getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Overnight window is 22:00 through 06:59")
    void overnightWindow() {
        assertThat(LocationClassifier.isOvernight(22)).isTrue();
        assertThat(LocationClassifier.isOvernight(6)).isTrue();
        assertThat(LocationClassifier.isOvernight(7)).isFalse();
        assertThat(LocationClassifier.isOvernight(21)).isFalse();
    }
}
