package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Vehicle starts moving again with ignition on: speed rises above the movement
 * threshold from at/below it. Has its own, longer cooldown (see EventRecorder).
 */
@Component
@Order(60)
public class VehicleMovingRule implements EventRule {

    private final double movingThresholdKmh;

    public VehicleMovingRule(@Value("${telemetry.events.moving-threshold-kmh:5}") double movingThresholdKmh) {
        this.movingThresholdKmh = movingThresholdKmh;
    }

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample previous = context.getPrevious();
        PositionSample current = context.getCurrent();
        if (previous == null || !current.hasIgnitionOn() || current.getSpeed() == null
                || current.getSpeed() <= movingThresholdKmh) {
            return List.of();
        }
        Double before = previous.getSpeed();
        if (before != null && before > movingThresholdKmh) {
            return List.of();
        }
        return List.of(EventCandidate.builder()
                .eventType(EventType.VEHICLE_MOVING)
                .severity(EventSeverity.INFO)
                .title("Vehicle Started Moving")
                .description(String.format("Vehicle is now moving at %.0f km/h", current.getSpeed()))
                .metadata(EventCandidate.metadataOf(
                        "speed", current.getSpeed(),
                        "previous_speed", before,
                        "ignition_on", current.getIgnitionOn()))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueBefore(before)
                .valueAfter(current.getSpeed())
                .build());
    }
}
