package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(30)
public class RapidAccelerationRule implements EventRule {

    private final double deltaKmh;

    public RapidAccelerationRule(@Value("${telemetry.events.rapid-acceleration-delta-kmh:30}") double deltaKmh) {
        this.deltaKmh = deltaKmh;
    }

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample previous = context.getPrevious();
        PositionSample current = context.getCurrent();
        if (previous == null || previous.getSpeed() == null || current.getSpeed() == null) {
            return List.of();
        }
        double delta = current.getSpeed() - previous.getSpeed();
        if (delta <= deltaKmh) {
            return List.of();
        }
        return List.of(EventCandidate.builder()
                .eventType(EventType.RAPID_ACCELERATION)
                .severity(EventSeverity.WARNING)
                .title("Rapid Acceleration")
                .description(String.format("Speed increased rapidly from %.0f to %.0f km/h",
                        previous.getSpeed(), current.getSpeed()))
                .metadata(EventCandidate.metadataOf(
                        "speed_before", previous.getSpeed(),
                        "speed_after", current.getSpeed(),
                        "delta", delta))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueBefore(previous.getSpeed())
                .valueAfter(current.getSpeed())
                .threshold(deltaKmh)
                .build());
    }
}
