package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Edge-triggered ignition transitions.
 *
 *  false -> true : ignition_on
 *  true -> false : ignition_off plus trip_completed, both carrying a summary of the
 *                  ignition-on run that just ended (duration, odometer distance, final battery)
 *
 * Unknown ignition on either side is not a transition.
 */
@Component
@Order(50)
public class IgnitionRule implements EventRule {

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample previous = context.getPrevious();
        PositionSample current = context.getCurrent();
        if (previous == null || previous.getIgnitionOn() == null || current.getIgnitionOn() == null
                || previous.getIgnitionOn().equals(current.getIgnitionOn())) {
            return List.of();
        }

        if (current.getIgnitionOn()) {
            return List.of(EventCandidate.builder()
                    .eventType(EventType.IGNITION_ON)
                    .severity(EventSeverity.INFO)
                    .title("Vehicle Started")
                    .description("Ignition turned on, vehicle is now active")
                    .metadata(EventCandidate.metadataOf(
                            "battery_percent", current.getBatteryPercent(),
                            "location_lat", current.getLatitude(),
                            "location_lon", current.getLongitude()))
                    .latitude(current.getLatitude())
                    .longitude(current.getLongitude())
                    .build());
        }

        Optional<PositionSample> runStart = context.getHistory()
                .findIgnitionRunStart(current.getVehicleId(), current.getTimestamp());
        Long durationMinutes = runStart
                .map(start -> ChronoUnit.MINUTES.between(start.getTimestamp(), current.getTimestamp()))
                .orElse(null);
        double distanceKm = runStart.map(start -> odometerDistanceKm(start, current)).orElse(0.0);

        Map<String, Object> summary = EventCandidate.metadataOf(
                "duration_minutes", durationMinutes,
                "distance_km", distanceKm,
                "final_battery", current.getBatteryPercent(),
                "location_lat", current.getLatitude(),
                "location_lon", current.getLongitude());
        runStart.ifPresent(start -> summary.put("started_at", start.getTimestamp().toString()));

        String after = durationMinutes != null ? " after " + durationMinutes + " minutes" : "";

        EventCandidate ignitionOff = EventCandidate.builder()
                .eventType(EventType.IGNITION_OFF)
                .severity(EventSeverity.INFO)
                .title("Engine Stopped")
                .description("Vehicle engine has been turned off" + after)
                .metadata(summary)
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .build();

        EventCandidate tripCompleted = EventCandidate.builder()
                .eventType(EventType.TRIP_COMPLETED)
                .severity(EventSeverity.INFO)
                .title("Trip Completed")
                .description(String.format("Trip ended%s, %.2f km driven", after, distanceKm))
                .metadata(new LinkedHashMap<>(summary))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueAfter(distanceKm)
                .build();

        return List.of(ignitionOff, tripCompleted);
    }

    private double odometerDistanceKm(PositionSample start, PositionSample end) {
        if (start.getOdometerTotal() == null || end.getOdometerTotal() == null) {
            return 0.0;
        }
        double meters = end.getOdometerTotal() - start.getOdometerTotal();
        return meters > 0 ? meters / 1000.0 : 0.0;
    }
}
