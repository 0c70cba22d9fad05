package com.fleetinsight.telemetry.service.health;

import com.fleetinsight.telemetry.config.CacheConfig;
import com.fleetinsight.telemetry.entity.DailyHealthFeature;
import com.fleetinsight.telemetry.entity.DailyHealthScore;
import com.fleetinsight.telemetry.repository.DailyHealthFeatureRepository;
import com.fleetinsight.telemetry.repository.DailyHealthScoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Upserts one vehicle-day of health rows.
 *
 * Transient storage failures are retried with exponential backoff, each attempt
 * in a fresh transaction; the last failure propagates to the batch driver.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthScoreWriter {

    private final DailyHealthFeatureRepository featureRepository;
    private final DailyHealthScoreRepository scoreRepository;

    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "${telemetry.health.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${telemetry.health.retry.backoff-ms:500}", multiplier = 2))
    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_HEALTH_HISTORY, allEntries = true)
    public DailyHealthScore write(DailyHealthFeature feature, DailyHealthScore score) {
        LocalDateTime now = LocalDateTime.now();
        // ids may be left over from a rolled-back attempt
        feature.setId(null);
        score.setId(null);

        featureRepository.findByVehicleIdAndScoreDate(feature.getVehicleId(), feature.getScoreDate())
                .ifPresent(existing -> feature.setId(existing.getId()));
        feature.setComputedAt(now);
        featureRepository.save(feature);

        scoreRepository.findByVehicleIdAndScoreDate(score.getVehicleId(), score.getScoreDate())
                .ifPresent(existing -> score.setId(existing.getId()));
        score.setComputedAt(now);
        DailyHealthScore saved = scoreRepository.save(score);

        log.debug("HEALTH: stored {} for vehicle {} — health {}, confidence {}",
                score.getScoreDate(), score.getVehicleId(), score.getHealthScore(), score.getConfidenceScore());
        return saved;
    }
}
