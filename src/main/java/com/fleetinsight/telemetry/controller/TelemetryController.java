package com.fleetinsight.telemetry.controller;

import com.fleetinsight.telemetry.dto.ApiResponse;
import com.fleetinsight.telemetry.dto.IngestionResult;
import com.fleetinsight.telemetry.dto.PositionSampleRequest;
import com.fleetinsight.telemetry.service.TelemetryAsyncService;
import com.fleetinsight.telemetry.service.TelemetryIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Sample intake from the ingestion collaborator.
 *
 *  POST /api/telemetry/samples : one sample, processed synchronously
 *  POST /api/telemetry/samples/batch : buffered samples, sorted and processed in order
 *  POST /api/telemetry/samples/async : one sample, 202 Accepted, processed in the background
 */
@RestController
@RequestMapping("/api/telemetry/samples")
@RequiredArgsConstructor
@Slf4j
public class TelemetryController {

    private final TelemetryIngestionService ingestionService;
    private final TelemetryAsyncService asyncService;

    @Value("${telemetry.ingestion.batch.max-size:500}")
    private int maxBatchSize;

    @PostMapping
    public ResponseEntity<ApiResponse> ingest(@Valid @RequestBody PositionSampleRequest request) {
        log.debug("Sample received for vehicle {} at {}", request.getVehicleId(), request.getTimestamp());
        IngestionResult result = ingestionService.ingest(request);
        String message = result.getStatus() == IngestionResult.Status.DUPLICATE
                ? "Duplicate sample ignored"
                : "Sample processed — " + result.getEvents().size() + " event(s)";
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    /**
     * Elements are validated one by one in the service so a bad sample is
     * rejected on its own instead of failing the whole request.
     */
    @PostMapping("/batch")
    public ResponseEntity<ApiResponse> ingestBatch(@RequestBody List<PositionSampleRequest> requests) {
        log.info("Batch received — {} sample(s)", requests.size());

        if (requests.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Batch is empty — nothing to process"));
        }
        if (requests.size() > maxBatchSize) {
            log.warn("Batch rejected — size {} exceeds max allowed {}", requests.size(), maxBatchSize);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(ApiResponse.error(
                    "Batch size " + requests.size() + " exceeds maximum allowed " + maxBatchSize
                            + ". Split into smaller batches."));
        }

        Map<String, Object> result = asyncService.ingestBatch(requests);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Batch processed: " + result.get("processed") + "/" + result.get("total")));
    }

    @PostMapping("/async")
    public ResponseEntity<ApiResponse> ingestAsync(@Valid @RequestBody PositionSampleRequest request) {
        asyncService.ingestAsync(request);
        return ResponseEntity.accepted().body(ApiResponse.success("Sample accepted for async processing"));
    }
}
