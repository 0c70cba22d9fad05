package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of running the detector on one sample: the predecessor it was
 * compared against (null for a vehicle's first sample) and the events recorded.
 */
@Getter
@AllArgsConstructor
public class DetectionResult {

    private final PositionSample previous;
    private final List<VehicleEvent> events;
}
