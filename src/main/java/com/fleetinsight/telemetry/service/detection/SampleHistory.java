package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.PositionSample;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Look-behind queries some rules need beyond the immediately preceding sample.
 */
public interface SampleHistory {

    /**
     * First sample of the ignition-on run that is still in progress just before {@code before}.
     */
    Optional<PositionSample> findIgnitionRunStart(String vehicleId, LocalDateTime before);

    /**
     * Start of the current low-speed ignition-on run ending at {@code at},
     * searched no further back than {@code lookback}.
     */
    Optional<LocalDateTime> findIdleRunStart(String vehicleId, LocalDateTime at, Duration lookback,
                                             double speedThreshold);
}
