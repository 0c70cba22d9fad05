package com.fleetinsight.telemetry.dto;

import com.fleetinsight.telemetry.entity.LearnedLocation;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A learned location matched by a proximity lookup, with its distance from the query point.
 */
@Getter
@AllArgsConstructor
public class NearbyLocation {

    private final LearnedLocation location;
    private final double distanceMeters;
}
