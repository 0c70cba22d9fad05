package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.TripSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Trips over ignition-on samples only, split by stops.
 *
 * A trip opens at the first sample with positive speed. It closes at the sample
 * where a zero-speed run began once that run has lasted idle-stop-minutes, or at
 * the previous sample when the feed goes quiet for longer than gap-minutes.
 */
@Component
public class IdleTimeoutTripStrategy implements TripSegmentationStrategy {

    private final Duration idleStop;
    private final Duration maxGap;

    public IdleTimeoutTripStrategy(@Value("${telemetry.trips.idle-stop-minutes:3}") long idleStopMinutes,
                                   @Value("${telemetry.trips.gap-minutes:3}") long gapMinutes) {
        this.idleStop = Duration.ofMinutes(idleStopMinutes);
        this.maxGap = Duration.ofMinutes(gapMinutes);
    }

    @Override
    public TripSource source() {
        return TripSource.IDLE_TIMEOUT;
    }

    @Override
    public TripScan scan(List<PositionSample> samples) {
        List<TripSegment> segments = new ArrayList<>();
        List<PositionSample> open = null;
        int stopIndex = -1;          // index in open where the current zero-speed run began
        PositionSample previous = null;

        for (PositionSample sample : samples) {
            if (!sample.hasIgnitionOn()) {
                continue;
            }
            boolean moving = sample.speedOrZero() > 0;

            if (open != null && previous != null
                    && Duration.between(previous.getTimestamp(), sample.getTimestamp()).compareTo(maxGap) > 0) {
                segments.add(new TripSegment(stopIndex >= 0 ? open.subList(0, stopIndex + 1) : open));
                open = null;
                stopIndex = -1;
            }

            if (open == null) {
                if (moving) {
                    open = new ArrayList<>();
                    open.add(sample);
                }
            } else {
                open.add(sample);
                if (moving) {
                    stopIndex = -1;
                } else {
                    if (stopIndex < 0) {
                        stopIndex = open.size() - 1;
                    }
                    PositionSample stopStart = open.get(stopIndex);
                    if (Duration.between(stopStart.getTimestamp(), sample.getTimestamp()).compareTo(idleStop) >= 0) {
                        segments.add(new TripSegment(open.subList(0, stopIndex + 1)));
                        open = null;
                        stopIndex = -1;
                    }
                }
            }
            previous = sample;
        }
        return new TripScan(segments, open != null ? open.get(0) : null);
    }
}
