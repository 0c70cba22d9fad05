package com.fleetinsight.telemetry.dto;

import com.fleetinsight.telemetry.entity.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * What happened to one ingested sample.
 */
@Getter
@Builder
@AllArgsConstructor
public class IngestionResult {

    public enum Status { STORED, DUPLICATE }

    private final Status status;
    private final String vehicleId;
    private final LocalDateTime timestamp;
    private final Long sampleId;
    /** true when a later sample of the vehicle was already stored */
    private final boolean late;
    private final List<EventType> events;
    private final int tripsWritten;

    public static IngestionResult duplicate(String vehicleId, LocalDateTime timestamp) {
        return new IngestionResult(Status.DUPLICATE, vehicleId, timestamp, null, false, List.of(), 0);
    }
}
