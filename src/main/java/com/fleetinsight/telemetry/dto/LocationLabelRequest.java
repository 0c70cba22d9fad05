package com.fleetinsight.telemetry.dto;

import com.fleetinsight.telemetry.entity.LocationType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual label for a learned location. Once set, automatic reclassification leaves it alone.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationLabelRequest {

    @NotNull(message = "Location type is required")
    private LocationType locationType;

    @Size(max = 120, message = "Label must be at most 120 characters")
    private String customLabel;
}
