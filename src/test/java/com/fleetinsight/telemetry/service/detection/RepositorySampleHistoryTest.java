package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RepositorySampleHistory.
 */
@ExtendWith(MockitoExtension.class)
class RepositorySampleHistoryTest {

    @Mock private PositionSampleRepository positionSampleRepository;

    @InjectMocks private RepositorySampleHistory history;

    private static final String VEHICLE = "V-250";
    private static final LocalDateTime AT = LocalDateTime.of(2026, 3, 2, 18, 0);

    private PositionSample sample(LocalDateTime ts, boolean ignition) {
        return PositionSample.builder().vehicleId(VEHICLE).timestamp(ts).ignitionOn(ignition).build();
    }

    @Test
    @DisplayName("Ignition run starts at the first sample after the last ignition-off")
    void ignitionRunStart_afterLastOff() {
        PositionSample off = sample(AT.minusMinutes(40), false);
        PositionSample firstOn = sample(AT.minusMinutes(39), true);
        when(positionSampleRepository.findTopByVehicleIdAndIgnitionOnFalseAndTimestampBeforeOrderByTimestampDesc(VEHICLE, AT))
                .thenReturn(Optional.of(off));
        when(positionSampleRepository.findFirstByVehicleIdAndTimestampAfterAndTimestampBeforeOrderByTimestampAsc(
                VEHICLE, off.getTimestamp(), AT)).thenReturn(Optional.of(firstOn));

        assertThat(history.findIgnitionRunStart(VEHICLE, AT)).containsSame(firstOn);
    }

    @Test
    @DisplayName("Never switched off → run starts at the vehicle's first sample if it was on")
    void ignitionRunStart_noOffSample_firstSample() {
        PositionSample first = sample(AT.minusHours(3), true);
        when(positionSampleRepository.findTopByVehicleIdAndIgnitionOnFalseAndTimestampBeforeOrderByTimestampDesc(VEHICLE, AT))
                .thenReturn(Optional.empty());
        when(positionSampleRepository.findFirstByVehicleIdAndTimestampBeforeOrderByTimestampAsc(VEHICLE, AT))
                .thenReturn(Optional.of(first));

        assertThat(history.findIgnitionRunStart(VEHICLE, AT)).containsSame(first);
    }

    @Test
    @DisplayName("Idle run starts at the first sample after the last moving sample in the lookback")
    void idleRunStart_afterLastBreak() {
        LocalDateTime lastBreak = AT.minusMinutes(45);
        when(positionSampleRepository.findLastIdleBreakTime(VEHICLE, AT.minusHours(2), AT, 5.0)).thenReturn(lastBreak);
        when(positionSampleRepository.findFirstTimeAfter(VEHICLE, lastBreak, AT)).thenReturn(AT.minusMinutes(44));

        assertThat(history.findIdleRunStart(VEHICLE, AT, Duration.ofHours(2), 5.0)).contains(AT.minusMinutes(44));
    }

    @Test
    @DisplayName("Idle for the whole lookback → run start bounded by the window")
    void idleRunStart_boundedByLookback() {
        LocalDateTime windowStart = AT.minusHours(2);
        when(positionSampleRepository.findLastIdleBreakTime(VEHICLE, windowStart, AT, 5.0)).thenReturn(null);
        when(positionSampleRepository.findFirstTimeAfter(VEHICLE, windowStart, AT)).thenReturn(windowStart.plusMinutes(1));

        assertThat(history.findIdleRunStart(VEHICLE, AT, Duration.ofHours(2), 5.0)).contains(windowStart.plusMinutes(1));
    }
}
