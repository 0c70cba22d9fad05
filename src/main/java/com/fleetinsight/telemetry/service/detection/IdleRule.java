package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Engine running while stationary for too long.
 * Both samples must be ignition-on and below the idle speed; the run length is
 * measured from the start of the current low-speed run within a bounded lookback.
 */
@Component
@Order(70)
public class IdleRule implements EventRule {

    private final double idleSpeedKmh;
    private final int thresholdMinutes;
    private final Duration lookback;

    public IdleRule(@Value("${telemetry.events.idle.speed-threshold-kmh:5}") double idleSpeedKmh,
                    @Value("${telemetry.events.idle.threshold-minutes:30}") int thresholdMinutes,
                    @Value("${telemetry.events.idle.lookback-hours:2}") int lookbackHours) {
        this.idleSpeedKmh = idleSpeedKmh;
        this.thresholdMinutes = thresholdMinutes;
        this.lookback = Duration.ofHours(lookbackHours);
    }

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample previous = context.getPrevious();
        PositionSample current = context.getCurrent();
        if (previous == null || !isIdle(previous) || !isIdle(current)) {
            return List.of();
        }

        Optional<LocalDateTime> runStart = context.getHistory().findIdleRunStart(
                current.getVehicleId(), current.getTimestamp(), lookback, idleSpeedKmh);
        if (runStart.isEmpty()) {
            return List.of();
        }
        long idleMinutes = ChronoUnit.MINUTES.between(runStart.get(), current.getTimestamp());
        if (idleMinutes < thresholdMinutes) {
            return List.of();
        }

        return List.of(EventCandidate.builder()
                .eventType(EventType.IDLE_TOO_LONG)
                .severity(EventSeverity.WARNING)
                .title("Extended Idle Time")
                .description(String.format("Vehicle has been idling for %d minutes", idleMinutes))
                .metadata(EventCandidate.metadataOf(
                        "idle_minutes", idleMinutes,
                        "battery_percent", current.getBatteryPercent(),
                        "threshold_minutes", thresholdMinutes))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueAfter((double) idleMinutes)
                .threshold((double) thresholdMinutes)
                .build());
    }

    private boolean isIdle(PositionSample sample) {
        return sample.hasIgnitionOn() && sample.getSpeed() != null && sample.getSpeed() < idleSpeedKmh;
    }
}
