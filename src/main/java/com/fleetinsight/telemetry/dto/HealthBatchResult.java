package com.fleetinsight.telemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Map;

/**
 * Outcome of a daily health sweep: per-vehicle failures are listed, they do not fail the sweep.
 */
@Getter
@Builder
@AllArgsConstructor
public class HealthBatchResult {

    private final LocalDate date;
    private final int total;
    private final int succeeded;
    private final int failed;
    /** vehicleId → error message */
    private final Map<String, String> failures;
}
