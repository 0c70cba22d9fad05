package com.fleetinsight.telemetry.service.detection;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event a rule wants to raise, before cooldown and persistence.
 */
@Getter
@Builder
public class EventCandidate {

    private final EventType eventType;
    private final EventSeverity severity;
    private final String title;
    private final String description;
    @Builder.Default
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Double latitude;
    private final Double longitude;
    private final Double valueBefore;
    private final Double valueAfter;
    private final Double threshold;

    /**
     * Builds an ordered metadata map from alternating keys and values. Null values are kept.
     */
    public static Map<String, Object> metadataOf(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("metadataOf expects key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
