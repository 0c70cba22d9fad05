package com.fleetinsight.telemetry.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed read caches.
 *
 *   learnedLocations : ranked location list per vehicle. Evicted for the vehicle
 *                      on every merged visit and wholesale on a manual label.
 *                      TTL: 30 minutes. Max entries: 5000.
 *
 *   healthHistory : health score ranges per (vehicle, from, to). Evicted
 *                      wholesale whenever a score is written.
 *                      TTL: 15 minutes. Max entries: 2000.
 *
 * The last-sample lookup of the event detector keeps its own Caffeine cache.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_LEARNED_LOCATIONS = "learnedLocations";

    public static final String CACHE_HEALTH_HISTORY = "healthHistory";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager — caches: '{}', '{}'",
                CACHE_LEARNED_LOCATIONS, CACHE_HEALTH_HISTORY);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_LEARNED_LOCATIONS, 30, 5000),
                buildCache(CACHE_HEALTH_HISTORY, 15, 2000)
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
