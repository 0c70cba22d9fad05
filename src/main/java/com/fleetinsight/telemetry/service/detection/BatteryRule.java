package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Battery level crossings.
 *
 * Each threshold fires once when the level crosses below it:
 *  - low_battery      : now below low, not below critical, previous at/above low (or unknown)
 *  - critical_battery : now below critical, previous at/above critical (or unknown)
 * A drop straight through both thresholds raises only critical_battery.
 */
@Component
@Order(10)
public class BatteryRule implements EventRule {

    private final int lowPercent;
    private final int criticalPercent;

    public BatteryRule(@Value("${telemetry.events.battery.low-percent:20}") int lowPercent,
                       @Value("${telemetry.events.battery.critical-percent:10}") int criticalPercent) {
        this.lowPercent = lowPercent;
        this.criticalPercent = criticalPercent;
    }

    @Override
    public List<EventCandidate> evaluate(DetectionContext context) {
        PositionSample current = context.getCurrent();
        Integer now = current.getBatteryPercent();
        if (now == null) {
            return List.of();
        }
        Integer before = context.previous().map(PositionSample::getBatteryPercent).orElse(null);

        if (now < criticalPercent && (before == null || before >= criticalPercent)) {
            return List.of(candidate(current, before, EventType.CRITICAL_BATTERY, EventSeverity.CRITICAL,
                    "Critical Battery Level",
                    String.format("Battery dropped to %d%%. Immediate attention required.", now),
                    criticalPercent));
        }
        if (now < lowPercent && now >= criticalPercent && (before == null || before >= lowPercent)) {
            return List.of(candidate(current, before, EventType.LOW_BATTERY, EventSeverity.WARNING,
                    "Low Battery Warning",
                    String.format("Battery at %d%%. Consider charging soon.", now),
                    lowPercent));
        }
        return List.of();
    }

    private EventCandidate candidate(PositionSample current, Integer before, EventType type,
                                     EventSeverity severity, String title, String description, int threshold) {
        return EventCandidate.builder()
                .eventType(type)
                .severity(severity)
                .title(title)
                .description(description)
                .metadata(EventCandidate.metadataOf(
                        "battery_percent", current.getBatteryPercent(),
                        "previous_percent", before))
                .latitude(current.getLatitude())
                .longitude(current.getLongitude())
                .valueBefore(before != null ? before.doubleValue() : null)
                .valueAfter(current.getBatteryPercent().doubleValue())
                .threshold((double) threshold)
                .build();
    }
}
