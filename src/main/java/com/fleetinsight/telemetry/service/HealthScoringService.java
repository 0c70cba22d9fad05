package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.config.CacheConfig;
import com.fleetinsight.telemetry.dto.HealthBatchResult;
import com.fleetinsight.telemetry.entity.DailyHealthFeature;
import com.fleetinsight.telemetry.entity.DailyHealthScore;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.TripSource;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.repository.DailyHealthScoreRepository;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import com.fleetinsight.telemetry.repository.TripRepository;
import com.fleetinsight.telemetry.repository.VehicleEventRepository;
import com.fleetinsight.telemetry.service.health.HealthFeatureCalculator;
import com.fleetinsight.telemetry.service.health.HealthScoreCalculator;
import com.fleetinsight.telemetry.service.health.HealthScoreWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Health Scorer.
 *
 * One feature row and one score row per (vehicle, day). Recomputing a day
 * overwrites both, and the same inputs always give the same numbers.
 */
@Service
@Slf4j
public class HealthScoringService {

    private final PositionSampleRepository positionSampleRepository;
    private final TripRepository tripRepository;
    private final VehicleEventRepository vehicleEventRepository;
    private final DailyHealthScoreRepository scoreRepository;
    private final HealthFeatureCalculator featureCalculator;
    private final HealthScoreCalculator scoreCalculator;
    private final HealthScoreWriter writer;
    private final Executor healthTaskExecutor;

    @Value("${telemetry.trips.health-source:IGNITION}")
    private TripSource tripSource;

    @Value("${telemetry.health.recompute-days-back:2}")
    private int recomputeDaysBack;

    public HealthScoringService(PositionSampleRepository positionSampleRepository,
                                TripRepository tripRepository,
                                VehicleEventRepository vehicleEventRepository,
                                DailyHealthScoreRepository scoreRepository,
                                HealthFeatureCalculator featureCalculator,
                                HealthScoreCalculator scoreCalculator,
                                HealthScoreWriter writer,
                                @Qualifier("healthTaskExecutor") Executor healthTaskExecutor) {
        this.positionSampleRepository = positionSampleRepository;
        this.tripRepository = tripRepository;
        this.vehicleEventRepository = vehicleEventRepository;
        this.scoreRepository = scoreRepository;
        this.featureCalculator = featureCalculator;
        this.scoreCalculator = scoreCalculator;
        this.writer = writer;
        this.healthTaskExecutor = healthTaskExecutor;
    }

    /**
     * Aggregates and scores one vehicle-day over [date 00:00, next day 00:00).
     * The trend baseline is the most recent stored score before {@code date}.
     */
    public DailyHealthScore computeDay(String vehicleId, LocalDate date) {
        LocalDateTime from = date.atStartOfDay();
        LocalDateTime to = date.plusDays(1).atStartOfDay();

        List<PositionSample> samples = positionSampleRepository
                .findByVehicleIdAndTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAsc(vehicleId, from, to);
        List<Trip> trips = tripRepository
                .findByVehicleIdAndSourceMethodAndStartTimeGreaterThanEqualAndStartTimeLessThan(vehicleId, tripSource, from, to);
        List<VehicleEvent> events = vehicleEventRepository
                .findByVehicleIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(vehicleId, from, to);

        DailyHealthFeature feature = featureCalculator.calculate(vehicleId, date, samples, trips, events);
        Integer previous = scoreRepository.findTopByVehicleIdAndScoreDateBeforeOrderByScoreDateDesc(vehicleId, date)
                .map(DailyHealthScore::getHealthScore)
                .orElse(null);
        DailyHealthScore score = scoreCalculator.score(feature, previous);

        DailyHealthScore saved = writer.write(feature, score);
        log.info("HEALTH: vehicle {} {} — health {}, confidence {}, trend {} (points {}, trips {}, events {})",
                vehicleId, date, saved.getHealthScore(), saved.getConfidenceScore(), saved.getTrend(),
                samples.size(), trips.size(), events.size());
        return saved;
    }

    /**
     * Recomputes the last {@code daysBack} days before {@code endDate} and the day itself,
     * oldest first so each day's trend sees the freshly recomputed day before it.
     */
    public List<DailyHealthScore> recomputeRecentWindow(String vehicleId, LocalDate endDate, Integer daysBack) {
        int back = daysBack != null ? daysBack : recomputeDaysBack;
        if (back < 0) {
            throw new IllegalArgumentException("daysBack must not be negative");
        }
        List<DailyHealthScore> scores = new ArrayList<>();
        for (LocalDate day = endDate.minusDays(back); !day.isAfter(endDate); day = day.plusDays(1)) {
            scores.add(computeDay(vehicleId, day));
        }
        return scores;
    }

    /** {@code days} days ending with {@code endDate}, oldest first */
    public List<DailyHealthScore> backfill(String vehicleId, LocalDate endDate, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        log.info("HEALTH: backfilling {} day(s) for vehicle {} up to {}", days, vehicleId, endDate);
        return recomputeRecentWindow(vehicleId, endDate, days - 1);
    }

    /**
     * Daily sweep: every vehicle with samples, trips or events on {@code date},
     * scored concurrently on the health pool. One vehicle failing does not stop the others.
     */
    public HealthBatchResult computeAllForDay(LocalDate date) {
        LocalDateTime from = date.atStartOfDay();
        LocalDateTime to = date.plusDays(1).atStartOfDay();

        TreeSet<String> vehicleIds = new TreeSet<>();
        vehicleIds.addAll(positionSampleRepository.findActiveVehicleIds(from, to));
        vehicleIds.addAll(tripRepository.findActiveVehicleIds(from, to));
        vehicleIds.addAll(vehicleEventRepository.findActiveVehicleIds(from, to));
        log.info("HEALTH: daily sweep for {} — {} active vehicle(s)", date, vehicleIds.size());

        Map<String, CompletableFuture<DailyHealthScore>> futures = new LinkedHashMap<>();
        for (String vehicleId : vehicleIds) {
            futures.put(vehicleId, CompletableFuture.supplyAsync(() -> computeDay(vehicleId, date), healthTaskExecutor));
        }

        int succeeded = 0;
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<DailyHealthScore>> entry : futures.entrySet()) {
            try {
                entry.getValue().join();
                succeeded++;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("HEALTH: vehicle {} failed for {} — {}", entry.getKey(), date, cause.getMessage());
                failures.put(entry.getKey(), cause.getMessage());
            }
        }

        log.info("HEALTH: daily sweep for {} complete — total: {}, succeeded: {}, failed: {}",
                date, vehicleIds.size(), succeeded, failures.size());
        return HealthBatchResult.builder()
                .date(date)
                .total(vehicleIds.size())
                .succeeded(succeeded)
                .failed(failures.size())
                .failures(failures)
                .build();
    }

    /** Newest first */
    @Cacheable(value = CacheConfig.CACHE_HEALTH_HISTORY, key = "#vehicleId + ':' + #from + ':' + #to")
    public List<DailyHealthScore> findScores(String vehicleId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        log.debug("[CACHE MISS] healthHistory for vehicle {} [{} .. {}]", vehicleId, from, to);
        return scoreRepository.findByVehicleIdAndScoreDateBetweenOrderByScoreDateDesc(vehicleId, from, to);
    }
}
