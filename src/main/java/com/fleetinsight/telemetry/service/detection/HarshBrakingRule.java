package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(40)
public class HarshBrakingRule implements EventRule {

    private final double deltaKmh;

    public HarshBrakingRule(@Value("${telemetry.events.harsh-braking-delta-kmh:40}") double deltaKmh) {
        this.deltaKmh = deltaKmh;
    }

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample previous = context.getPrevious();
        PositionSample current = context.getCurrent();
        if (previous == null || previous.getSpeed() == null || current.getSpeed() == null) {
            return List.of();
        }
        double drop = previous.getSpeed() - current.getSpeed();
        if (drop <= deltaKmh) {
            return List.of();
        }
        return List.of(EventCandidate.builder()
                .eventType(EventType.HARSH_BRAKING)
                .severity(EventSeverity.WARNING)
                .title("Harsh Braking Detected")
                .description(String.format("Speed dropped rapidly from %.0f to %.0f km/h",
                        previous.getSpeed(), current.getSpeed()))
                .metadata(EventCandidate.metadataOf(
                        "speed_before", previous.getSpeed(),
                        "speed_after", current.getSpeed(),
                        "delta", drop))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueBefore(previous.getSpeed())
                .valueAfter(current.getSpeed())
                .threshold(deltaKmh)
                .build());
    }
}
