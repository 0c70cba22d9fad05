package com.fleetinsight.telemetry.controller;

import com.fleetinsight.telemetry.dto.ApiResponse;
import com.fleetinsight.telemetry.entity.DistanceMethod;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.TripSource;
import com.fleetinsight.telemetry.service.TripSegmentationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TripController.
 *
 * Test cases:
 *  1. getTrips_fromAfterTo_returnsBadRequest
 *     Inverted window → 400, service never queried.
 *
 *  2. getTrips_bySource_mapsTripFields
 *     Trips are returned as response maps tagged with their source method.
 */
@ExtendWith(MockitoExtension.class)
class TripControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private TripSegmentationService tripSegmentationService;

    @InjectMocks
    private TripController tripController;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final String VEHICLE = "KA01AB1234";
    private static final LocalDateTime FROM = LocalDateTime.of(2026, 3, 1, 0, 0);
    private static final LocalDateTime TO = LocalDateTime.of(2026, 3, 2, 0, 0);

    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("from after to → 400 Bad Request")
    void getTrips_fromAfterTo_returnsBadRequest() {
        ResponseEntity<ApiResponse> response = tripController.getTrips(VEHICLE, TO, FROM, null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().isSuccess()).isFalse();
        verifyNoInteractions(tripSegmentationService);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Trips for a source → 200 with source and distance method in each entry")
    void getTrips_bySource_mapsTripFields() {
        Trip trip = Trip.builder()
                .id(3L)
                .vehicleId(VEHICLE)
                .sourceMethod(TripSource.IDLE_TIMEOUT)
                .startTime(FROM.plusHours(8))
                .endTime(FROM.plusHours(9))
                .distanceKm(14.2)
                .distanceMethod(DistanceMethod.GREAT_CIRCLE)
                .durationSeconds(3600L)
                .sampleCount(61)
                .build();
        when(tripSegmentationService.findTrips(VEHICLE, FROM, TO, TripSource.IDLE_TIMEOUT)).thenReturn(List.of(trip));

        ResponseEntity<ApiResponse> response = tripController.getTrips(VEHICLE, FROM, TO, TripSource.IDLE_TIMEOUT);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> body = (List<Map<String, Object>>) response.getBody().getData();
        assertThat(body).singleElement().satisfies(m -> {
            assertThat(m).containsEntry("sourceMethod", "IDLE_TIMEOUT");
            assertThat(m).containsEntry("distanceMethod", "GREAT_CIRCLE");
            assertThat(m).containsEntry("distanceKm", 14.2);
        });
    }
}
