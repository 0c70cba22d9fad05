package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.PositionSample;
import lombok.Getter;

import java.util.List;

/**
 * A closed run of samples a strategy considers one trip, first to last sample inclusive.
 */
@Getter
public class TripSegment {

    private final List<PositionSample> samples;

    public TripSegment(List<PositionSample> samples) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("A trip segment needs at least one sample");
        }
        this.samples = List.copyOf(samples);
    }

    public PositionSample first() {
        return samples.get(0);
    }

    public PositionSample last() {
        return samples.get(samples.size() - 1);
    }
}
