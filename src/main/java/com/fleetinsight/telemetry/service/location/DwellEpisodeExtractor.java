package com.fleetinsight.telemetry.service.location;

import com.fleetinsight.telemetry.entity.ParkingSession;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds stationary runs in an ordered sample sequence, with the same boundaries
 * the live parking tracker uses: a run opens on the first stationary sample after
 * a moving one and closes on the next moving sample.
 */
@Component
public class DwellEpisodeExtractor {

    private final double stationarySpeedKmh;

    public DwellEpisodeExtractor(@Value("${telemetry.locations.stationary-speed-kmh:2}") double stationarySpeedKmh) {
        this.stationarySpeedKmh = stationarySpeedKmh;
    }

    /** Parked with ignition off, or idling below the stationary speed */
    public boolean isStationary(PositionSample sample) {
        return !sample.hasIgnitionOn() || sample.speedOrZero() < stationarySpeedKmh;
    }

    /**
     * @param samples one vehicle's samples, oldest first
     * @param minDurationMinutes shorter episodes are left out
     */
    public List<DwellEpisode> extract(List<PositionSample> samples, long minDurationMinutes) {
        List<DwellEpisode> episodes = new ArrayList<>();
        PositionSample runStart = null;
        PositionSample previous = null;

        for (PositionSample sample : samples) {
            boolean stationary = isStationary(sample);
            if (previous != null) {
                boolean wasStationary = isStationary(previous);
                if (!wasStationary && stationary) {
                    runStart = sample;
                } else if (wasStationary && !stationary && runStart != null) {
                    DwellEpisode episode = new DwellEpisode(
                            runStart.getTimestamp(), sample.getTimestamp(),
                            runStart.getLatitude(), runStart.getLongitude(),
                            runStart.hasIgnitionOn() ? ParkingSession.Trigger.IDLE : ParkingSession.Trigger.IGNITION_OFF);
                    if (episode.durationMinutes() >= minDurationMinutes) {
                        episodes.add(episode);
                    }
                    runStart = null;
                }
            }
            previous = sample;
        }
        return episodes;
    }
}
