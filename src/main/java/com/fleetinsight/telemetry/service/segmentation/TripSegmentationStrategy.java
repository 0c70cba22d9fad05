package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.TripSource;

import java.util.List;

/**
 * A named way of cutting a vehicle's timeline into trips.
 *
 * Implementations are pure: the same ordered samples always yield the same
 * segments. A run still open at the end of the input is not returned.
 */
public interface TripSegmentationStrategy {

    TripSource source();

    /**
     * @param samples one vehicle's samples, oldest first
     * @return closed segments in start order, plus where the trailing open run starts
     */
    TripScan scan(List<PositionSample> samples);

    /** Closed segments only */
    default List<TripSegment> segment(List<PositionSample> samples) {
        return scan(samples).getClosed();
    }
}
