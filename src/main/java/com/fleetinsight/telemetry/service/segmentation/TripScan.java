package com.fleetinsight.telemetry.service.segmentation;

import com.fleetinsight.telemetry.entity.PositionSample;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Result of running a strategy over an ordered sample run: the segments that
 * closed, and the first sample of the run still open at the end, if any.
 *
 * Replaying from {@code openRunStart} (or from after the last sample when nothing
 * is open) with later samples appended yields the same further segments as
 * replaying the whole input.
 */
@Getter
public class TripScan {

    private final List<TripSegment> closed;
    private final PositionSample openRunStart;

    public TripScan(List<TripSegment> closed, PositionSample openRunStart) {
        this.closed = List.copyOf(closed);
        this.openRunStart = openRunStart;
    }

    public Optional<PositionSample> openRun() {
        return Optional.ofNullable(openRunStart);
    }
}
