package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.config.CacheConfig;
import com.fleetinsight.telemetry.entity.LearnedLocation;
import com.fleetinsight.telemetry.repository.LearnedLocationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cached reads of learned locations.
 *
 * Kept apart from LocationClusteringService so calls go through the cache proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LearnedLocationQueryService {

    private final LearnedLocationRepository learnedLocationRepository;

    /** Ranked by visit count, most recent visit first on ties */
    @Cacheable(value = CacheConfig.CACHE_LEARNED_LOCATIONS, key = "#vehicleId")
    public List<LearnedLocation> rankedLocations(String vehicleId) {
        log.debug("[CACHE MISS] learnedLocations for vehicle {} — loading from DB", vehicleId);
        return learnedLocationRepository.findByVehicleIdOrderByVisitCountDescLastVisitDesc(vehicleId);
    }

    @CacheEvict(value = CacheConfig.CACHE_LEARNED_LOCATIONS, key = "#vehicleId")
    public void evict(String vehicleId) {
        log.debug("[CACHE EVICT] learnedLocations for vehicle {}", vehicleId);
    }
}
