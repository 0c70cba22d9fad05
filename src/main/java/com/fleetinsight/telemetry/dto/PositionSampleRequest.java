package com.fleetinsight.telemetry.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One position/status reading as delivered by the ingestion collaborator.
 * Only vehicle, time and position are mandatory; the status fields may be absent.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSampleRequest {

    @NotBlank(message = "Vehicle ID is required")
    @Size(max = 64, message = "Vehicle ID must be at most 64 characters")
    private String vehicleId;

    @NotNull(message = "Timestamp is required")
    private LocalDateTime timestamp;

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double longitude;

    @DecimalMin(value = "0.0", message = "Speed must not be negative")
    @DecimalMax(value = "300.0", message = "Speed must be <= 300 km/h")
    private Double speed; // km/h

    private Boolean ignitionOn;

    @Min(value = 0, message = "Battery percent must be >= 0")
    @Max(value = 100, message = "Battery percent must be <= 100")
    private Integer batteryPercent;

    @PositiveOrZero(message = "Odometer must not be negative")
    private Double odometerTotal; // cumulative meters

    private Boolean online;
}
