package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.dto.IngestionResult;
import com.fleetinsight.telemetry.dto.PositionSampleRequest;
import com.fleetinsight.telemetry.exception.InvalidSampleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Batch and background entry points around TelemetryIngestionService.
 *
 * Separate bean so @Async goes through the Spring proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryAsyncService {

    private final TelemetryIngestionService ingestionService;

    /**
     * Caller gets 202 Accepted immediately; the sample is processed on the telemetry pool.
     */
    @Async("telemetryTaskExecutor")
    public CompletableFuture<IngestionResult> ingestAsync(PositionSampleRequest request) {
        try {
            return CompletableFuture.completedFuture(ingestionService.ingest(request));
        } catch (RuntimeException e) {
            log.error("INGEST: async processing failed — vehicle: {}, ts: {} — {}",
                    request.getVehicleId(), request.getTimestamp(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Buffered samples, e.g. from a device that was offline.
     *
     * Samples are sorted by timestamp first so every rule sees the true predecessor;
     * a rejected or failing sample is counted and skipped.
     */
    public Map<String, Object> ingestBatch(List<PositionSampleRequest> requests) {
        log.info("INGEST: batch started — {} sample(s)", requests.size());

        List<PositionSampleRequest> sorted = requests.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(PositionSampleRequest::getTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        int stored = 0, duplicates = 0, rejected = 0, failed = 0;
        for (PositionSampleRequest req : sorted) {
            try {
                IngestionResult result = ingestionService.ingest(req);
                if (result.getStatus() == IngestionResult.Status.DUPLICATE) {
                    duplicates++;
                } else {
                    stored++;
                }
            } catch (InvalidSampleException e) {
                log.warn("INGEST: batch sample rejected — {}", e.getMessage());
                rejected++;
            } catch (RuntimeException e) {
                log.error("INGEST: batch sample failed — vehicle: {}, ts: {} — {}",
                        req.getVehicleId(), req.getTimestamp(), e.getMessage());
                failed++;
            }
        }
        rejected += requests.size() - sorted.size();

        log.info("INGEST: batch complete — total: {}, stored: {}, duplicates: {}, rejected: {}, failed: {}",
                requests.size(), stored, duplicates, rejected, failed);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", requests.size());
        summary.put("processed", stored + duplicates);
        summary.put("stored", stored);
        summary.put("duplicates", duplicates);
        summary.put("rejected", rejected);
        summary.put("failed", failed);
        return summary;
    }
}
