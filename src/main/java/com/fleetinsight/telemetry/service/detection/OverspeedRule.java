package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Speed crossing above the limit. Readings above the sane maximum are GPS garbage and ignored.
 */
@Component
@Order(20)
public class OverspeedRule implements EventRule {

    private final double thresholdKmh;
    private final double criticalKmh;
    private final double maxSaneKmh;

    public OverspeedRule(@Value("${telemetry.events.overspeed.threshold-kmh:100}") double thresholdKmh,
                         @Value("${telemetry.events.overspeed.critical-kmh:120}") double criticalKmh,
                         @Value("${telemetry.events.overspeed.max-sane-kmh:300}") double maxSaneKmh) {
        this.thresholdKmh = thresholdKmh;
        this.criticalKmh = criticalKmh;
        this.maxSaneKmh = maxSaneKmh;
    }

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample current = context.getCurrent();
        Double speed = current.getSpeed();
        if (speed == null || speed > maxSaneKmh || speed <= thresholdKmh) {
            return List.of();
        }
        Double before = context.previous().map(PositionSample::getSpeed).orElse(null);
        if (before != null && before > thresholdKmh) {
            return List.of();
        }

        boolean critical = speed > criticalKmh;
        return List.of(EventCandidate.builder()
                .eventType(EventType.OVERSPEEDING)
                .severity(critical ? EventSeverity.CRITICAL : EventSeverity.ERROR)
                .title(critical ? "Critical: Excessive Speed" : "Overspeeding Detected")
                .description(String.format("Vehicle speed reached %.0f km/h (limit: %.0f km/h)", speed, thresholdKmh))
                .metadata(EventCandidate.metadataOf(
                        "speed", speed,
                        "threshold", thresholdKmh,
                        "previous_speed", before))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueBefore(before)
                .valueAfter(speed)
                .threshold(thresholdKmh)
                .build());
    }
}
