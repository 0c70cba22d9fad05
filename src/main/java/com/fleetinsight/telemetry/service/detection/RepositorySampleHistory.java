package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * SampleHistory backed by the position store.
 */
@Component
@RequiredArgsConstructor
public class RepositorySampleHistory implements SampleHistory {

    private final PositionSampleRepository positionSampleRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PositionSample> findIgnitionRunStart(String vehicleId, LocalDateTime before) {
        Optional<PositionSample> lastOff = positionSampleRepository
                .findTopByVehicleIdAndIgnitionOnFalseAndTimestampBeforeOrderByTimestampDesc(vehicleId, before);

        Optional<PositionSample> start = lastOff.isPresent()
                ? positionSampleRepository.findFirstByVehicleIdAndTimestampAfterAndTimestampBeforeOrderByTimestampAsc(
                        vehicleId, lastOff.get().getTimestamp(), before)
                : positionSampleRepository.findFirstByVehicleIdAndTimestampBeforeOrderByTimestampAsc(vehicleId, before);

        return start.filter(PositionSample::hasIgnitionOn);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LocalDateTime> findIdleRunStart(String vehicleId, LocalDateTime at, Duration lookback,
                                                    double speedThreshold) {
        LocalDateTime windowStart = at.minus(lookback);
        LocalDateTime lastBreak = positionSampleRepository
                .findLastIdleBreakTime(vehicleId, windowStart, at, speedThreshold);
        LocalDateTime searchFrom = lastBreak != null ? lastBreak : windowStart;
        return Optional.ofNullable(positionSampleRepository.findFirstTimeAfter(vehicleId, searchFrom, at));
    }
}
