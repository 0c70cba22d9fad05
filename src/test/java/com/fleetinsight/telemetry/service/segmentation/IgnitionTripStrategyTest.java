package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.TripSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IgnitionTripStrategy.
 *
 * Test cases:
 *  1. offOnOnOff_singleSegmentFromSecondToFourthSample
 *  2. longGapWithIgnitionOn_splitsAtPreviousSample
 *  3. trailingOpenRun_notReturned
 *  4. firstSampleAlreadyOn_opensImmediately
 *  5. scan_reportsWhereOpenRunStarts
 */
class IgnitionTripStrategyTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 4, 8, 0);

    private final IgnitionTripStrategy strategy = new IgnitionTripStrategy(3);

    private PositionSample sample(int minute, boolean ignition, double speed) {
        return PositionSample.builder()
                .vehicleId("V-400")
                .timestamp(T0.plusMinutes(minute))
                .latitude(12.90 + minute * 0.001)
                .longitude(77.50)
                .ignitionOn(ignition)
                .speed(speed)
                .build();
    }

    @Test
    @DisplayName("off, on, on, off one minute apart → one segment spanning samples 2..4")
    void offOnOnOff_singleSegmentFromSecondToFourthSample() {
        PositionSample s1 = sample(0, false, 0);
        PositionSample s2 = sample(1, true, 0);
        PositionSample s3 = sample(2, true, 60);
        PositionSample s4 = sample(3, false, 0);

        List<TripSegment> segments = strategy.segment(List.of(s1, s2, s3, s4));

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).getSamples()).containsExactly(s2, s3, s4);
        assertThat(strategy.source()).isEqualTo(TripSource.IGNITION);
    }

    @Test
    @DisplayName("4-minute silence with ignition on → trip closes at the sample before the gap")
    void longGapWithIgnitionOn_splitsAtPreviousSample() {
        PositionSample a = sample(0, true, 30);
        PositionSample b = sample(1, true, 40);
        PositionSample c = sample(5, true, 35);
        PositionSample d = sample(6, true, 20);
        PositionSample e = sample(7, false, 0);

        List<TripSegment> segments = strategy.segment(List.of(a, b, c, d, e));

        assertThat(segments).hasSize(2);
        assertThat(segments.get(0).getSamples()).containsExactly(a, b);
        assertThat(segments.get(1).getSamples()).containsExactly(c, d, e);
    }

    @Test
    @DisplayName("Exactly 3 minutes between samples → not a gap")
    void gapAtThreshold_notSplit() {
        List<TripSegment> segments = strategy.segment(List.of(
                sample(0, true, 30), sample(3, true, 30), sample(4, false, 0)));

        assertThat(segments).singleElement()
                .satisfies(s -> assertThat(s.getSamples()).hasSize(3));
    }

    @Test
    @DisplayName("Ignition still on at the end of input → no segment")
    void trailingOpenRun_notReturned() {
        assertThat(strategy.segment(List.of(sample(0, false, 0), sample(1, true, 20), sample(2, true, 30))))
                .isEmpty();
    }

    @Test
    @DisplayName("Ignition already on in the first sample → trip starts there")
    void firstSampleAlreadyOn_opensImmediately() {
        PositionSample a = sample(0, true, 10);
        PositionSample b = sample(1, false, 0);

        assertThat(strategy.segment(List.of(a, b))).singleElement()
                .satisfies(s -> assertThat(s.getSamples()).containsExactly(a, b));
    }

    @Test
    @DisplayName("scan → open run starts at the first ignition-on sample after the last close or gap split")
    void scan_reportsWhereOpenRunStarts() {
        PositionSample on = sample(1, true, 20);
        PositionSample afterGap = sample(6, true, 30);

        assertThat(strategy.scan(List.of(sample(0, false, 0), on, sample(2, true, 30))).openRun()).containsSame(on);
        TripScan split = strategy.scan(List.of(sample(0, false, 0), on, sample(2, true, 30), afterGap));
        assertThat(split.getClosed()).hasSize(1);
        assertThat(split.openRun()).containsSame(afterGap);
        assertThat(strategy.scan(List.of(on, sample(2, false, 0))).openRun()).isEmpty();
    }
}
