package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.PositionSample;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Inputs shared by all rules for one evaluation.
 * {@code previous} is null for the first sample of a vehicle.
 */
@Getter
@AllArgsConstructor
public class DetectionContext {

    private final PositionSample previous;
    private final PositionSample current;
    private final SampleHistory history;

    public boolean hasPrevious() {
        return previous != null;
    }

    public Optional<PositionSample> previous() {
        return Optional.ofNullable(previous);
    }

    public String vehicleId() {
        return current.getVehicleId();
    }
}
