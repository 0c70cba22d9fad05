package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.TripSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Trips bounded by ignition transitions.
 *
 *  - opens on false→true, or on the first sample when ignition is already on
 *  - closes on the true→false sample, which belongs to the trip
 *  - a gap longer than gap-minutes with ignition still on closes the trip at the
 *    previous sample and opens a new one at the current sample
 */
@Component
public class IgnitionTripStrategy implements TripSegmentationStrategy {

    private final Duration maxGap;

    public IgnitionTripStrategy(@Value("${telemetry.trips.gap-minutes:3}") long gapMinutes) {
        this.maxGap = Duration.ofMinutes(gapMinutes);
    }

    @Override
    public TripSource source() {
        return TripSource.IGNITION;
    }

    @Override
    public TripScan scan(List<PositionSample> samples) {
        List<TripSegment> segments = new ArrayList<>();
        List<PositionSample> open = null;
        PositionSample previous = null;

        for (PositionSample sample : samples) {
            boolean on = sample.hasIgnitionOn();

            if (open == null) {
                if (on) {
                    open = new ArrayList<>();
                    open.add(sample);
                }
            } else if (!on) {
                open.add(sample);
                segments.add(new TripSegment(open));
                open = null;
            } else if (Duration.between(previous.getTimestamp(), sample.getTimestamp()).compareTo(maxGap) > 0) {
                segments.add(new TripSegment(open));
                open = new ArrayList<>();
                open.add(sample);
            } else {
                open.add(sample);
            }
            previous = sample;
        }
        return new TripScan(segments, open != null ? open.get(0) : null);
    }
}
