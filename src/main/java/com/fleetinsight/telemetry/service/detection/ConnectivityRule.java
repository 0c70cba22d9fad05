package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Online/offline flips reported by the device.
 */
@Component
@Order(80)
public class ConnectivityRule implements EventRule {

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample previous = context.getPrevious();
        PositionSample current = context.getCurrent();
        if (previous == null || previous.getOnline() == null || current.getOnline() == null
                || previous.getOnline().equals(current.getOnline())) {
            return List.of();
        }

        long gapMinutes = ChronoUnit.MINUTES.between(previous.getTimestamp(), current.getTimestamp());
        boolean online = current.getOnline();
        return List.of(EventCandidate.builder()
                .eventType(online ? EventType.ONLINE : EventType.OFFLINE)
                .severity(online ? EventSeverity.INFO : EventSeverity.WARNING)
                .title(online ? "Vehicle Back Online" : "Vehicle Offline")
                .description(online
                        ? String.format("Vehicle reconnected after %d minutes", gapMinutes)
                        : "Vehicle stopped reporting as online")
                .metadata(EventCandidate.metadataOf(
                        "previous_sample_time", previous.getTimestamp().toString(),
                        "gap_minutes", gapMinutes,
                        "battery_percent", current.getBatteryPercent()))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .build());
    }
}
