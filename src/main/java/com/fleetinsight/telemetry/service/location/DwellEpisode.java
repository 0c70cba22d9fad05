package com.fleetinsight.telemetry.service.location;

import com.fleetinsight.telemetry.entity.ParkingSession;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A closed stationary run: where the vehicle stopped, when, and for how long.
 */
@Getter
@AllArgsConstructor
public class DwellEpisode {

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final double latitude;
    private final double longitude;
    private final ParkingSession.Trigger trigger;

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}
