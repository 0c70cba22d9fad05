package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.config.CacheConfig;
import com.fleetinsight.telemetry.dto.LocationLabelRequest;
import com.fleetinsight.telemetry.dto.NearbyLocation;
import com.fleetinsight.telemetry.entity.LearnedLocation;
import com.fleetinsight.telemetry.entity.LocationType;
import com.fleetinsight.telemetry.entity.LocationVisitPattern;
import com.fleetinsight.telemetry.entity.ParkingSession;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.TimeOfDay;
import com.fleetinsight.telemetry.exception.ResourceNotFoundException;
import com.fleetinsight.telemetry.repository.LearnedLocationRepository;
import com.fleetinsight.telemetry.repository.LocationVisitPatternRepository;
import com.fleetinsight.telemetry.repository.ParkingSessionRepository;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import com.fleetinsight.telemetry.service.location.DwellEpisode;
import com.fleetinsight.telemetry.service.location.DwellEpisodeExtractor;
import com.fleetinsight.telemetry.service.location.LocationClassifier;
import com.fleetinsight.telemetry.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Location Clusterer.
 *
 *  - recordVisit      : merge a dwell point into the nearest cluster within the radius, or start a new one
 *  - classify         : re-derive the location type once a cluster has enough visits
 *  - findNearby       : "am I at a known place" proximity lookup
 *  - labelLocation    : manual override of the type
 *  - learnFromHistory : replay dwell episodes from stored samples
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationClusteringService {

    private final LearnedLocationRepository learnedLocationRepository;
    private final LocationVisitPatternRepository visitPatternRepository;
    private final ParkingSessionRepository parkingSessionRepository;
    private final PositionSampleRepository positionSampleRepository;
    private final LearnedLocationQueryService learnedLocationQueryService;
    private final LocationClassifier locationClassifier;
    private final DwellEpisodeExtractor dwellEpisodeExtractor;

    @Value("${telemetry.locations.default-radius-meters:50}")
    private double clusterRadiusMeters;

    @Value("${telemetry.locations.nearby-radius-meters:100}")
    private double nearbyRadiusMeters;

    @Value("${telemetry.locations.min-dwell-minutes:15}")
    private long minDwellMinutes;

    @Value("${telemetry.locations.history-days:30}")
    private int historyDays;

    /**
     * Merges one visit. The centroid moves to the midpoint of the old centroid
     * and the new point; first/last visit widen to cover the visit interval.
     */
    @Transactional
    public LearnedLocation recordVisit(String vehicleId, double latitude, double longitude,
                                       long durationMinutes, LocalDateTime arrival, LocalDateTime departure) {
        Optional<NearbyLocation> nearest = nearestWithin(vehicleId, latitude, longitude, clusterRadiusMeters);

        LearnedLocation location;
        if (nearest.isPresent()) {
            location = nearest.get().getLocation();
            double[] centroid = GeoUtil.midpoint(location.getLatitude(), location.getLongitude(), latitude, longitude);
            location.setLatitude(centroid[0]);
            location.setLongitude(centroid[1]);
            location.setVisitCount(location.getVisitCount() + 1);
            location.setTotalDurationMinutes(location.getTotalDurationMinutes() + durationMinutes);
            location.setFirstVisit(min(location.getFirstVisit(), arrival));
            location.setLastVisit(max(location.getLastVisit(), departure));
            log.info("CLUSTER: merged visit into location #{} for vehicle {} — visits: {}, drift: {} m",
                    location.getId(), vehicleId, location.getVisitCount(),
                    String.format("%.1f", nearest.get().getDistanceMeters() / 2.0));
        } else {
            location = LearnedLocation.builder()
                    .vehicleId(vehicleId)
                    .latitude(latitude)
                    .longitude(longitude)
                    .radiusMeters(clusterRadiusMeters)
                    .locationType(LocationType.UNKNOWN)
                    .visitCount(1)
                    .totalDurationMinutes(durationMinutes)
                    .firstVisit(arrival)
                    .lastVisit(departure)
                    .confidence(0.05)
                    .autoDetected(true)
                    .build();
            log.info("CLUSTER: new location for vehicle {} at ({}, {})",
                    vehicleId, String.format("%.5f", latitude), String.format("%.5f", longitude));
        }
        location.setTypicalDurationMinutes((int) (location.getTotalDurationMinutes() / location.getVisitCount()));
        location = learnedLocationRepository.save(location);

        updateVisitPattern(location.getId(), arrival, durationMinutes);
        if (locationClassifier.canClassify(location)) {
            classify(location);
        }
        learnedLocationQueryService.evict(vehicleId);
        return location;
    }

    /**
     * Re-derives type, typical arrival hour and confidence from the visit patterns
     * and the samples inside the radius during the last history-days before the last visit.
     */
    @Transactional
    public LearnedLocation classify(LearnedLocation location) {
        if (!locationClassifier.canClassify(location)) {
            return location;
        }
        List<LocationVisitPattern> patterns = visitPatternRepository.findByLocationId(location.getId());
        List<LocalDateTime> nearbyTimes = nearbySampleTimes(location);

        LocationClassifier.Classification result = locationClassifier.classify(location, patterns, nearbyTimes);
        if (result.getType() != location.getLocationType()) {
            log.info("CLUSTER: location #{} classified {} → {} ({} visits, confidence {})",
                    location.getId(), location.getLocationType(), result.getType(),
                    location.getVisitCount(), result.getConfidence());
        }
        location.setLocationType(result.getType());
        if (result.getTypicalArrivalHour() != null) {
            location.setTypicalArrivalHour(result.getTypicalArrivalHour());
        }
        location.setConfidence(result.getConfidence());
        return learnedLocationRepository.save(location);
    }

    /**
     * Learned locations within the radius of a point, nearest first.
     *
     * @param vehicleId    optional; null searches every vehicle
     * @param radiusMeters optional; defaults to nearby-radius-meters
     */
    @Transactional(readOnly = true)
    public List<NearbyLocation> findNearby(double latitude, double longitude, Double radiusMeters, String vehicleId) {
        double radius = radiusMeters != null ? radiusMeters : nearbyRadiusMeters;
        if (radius <= 0) {
            throw new IllegalArgumentException("Radius must be positive");
        }
        double[] deltas = GeoUtil.boundingDeltas(latitude, radius);
        List<LearnedLocation> candidates = vehicleId != null
                ? learnedLocationRepository.findByVehicleIdAndLatitudeBetweenAndLongitudeBetween(vehicleId,
                        latitude - deltas[0], latitude + deltas[0], longitude - deltas[1], longitude + deltas[1])
                : learnedLocationRepository.findByLatitudeBetweenAndLongitudeBetween(
                        latitude - deltas[0], latitude + deltas[0], longitude - deltas[1], longitude + deltas[1]);

        return candidates.stream()
                .map(l -> new NearbyLocation(l, GeoUtil.calculateDistance(
                        latitude, longitude, l.getLatitude(), l.getLongitude())))
                .filter(n -> n.getDistanceMeters() <= radius)
                .sorted(Comparator.comparingDouble(NearbyLocation::getDistanceMeters))
                .toList();
    }

    public List<LearnedLocation> rankedLocations(String vehicleId) {
        return learnedLocationQueryService.rankedLocations(vehicleId);
    }

    /** Manual label: fixes the type, full confidence, no further auto-classification */
    @Transactional
    @CacheEvict(value = CacheConfig.CACHE_LEARNED_LOCATIONS, allEntries = true)
    public LearnedLocation labelLocation(Long locationId, LocationLabelRequest request) {
        LearnedLocation location = learnedLocationRepository.findById(locationId)
                .orElseThrow(() -> new ResourceNotFoundException("Learned location", locationId));
        location.setLocationType(request.getLocationType());
        location.setCustomLabel(request.getCustomLabel());
        location.setAutoDetected(false);
        location.setConfidence(1.0);
        log.info("CLUSTER: location #{} labelled {} '{}'", locationId, request.getLocationType(),
                request.getCustomLabel());
        return learnedLocationRepository.save(location);
    }

    /**
     * Replays dwell episodes of the last {@code days} days. Episodes already
     * recorded as a parking session (same vehicle and start time) are skipped,
     * so repeated runs do not double-count visits.
     */
    @Transactional
    public Map<String, Object> learnFromHistory(String vehicleId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Days must be positive");
        }
        LocalDateTime since = LocalDateTime.now().minusDays(days);
        List<PositionSample> samples =
                positionSampleRepository.findByVehicleIdAndTimestampAfterOrderByTimestampAsc(vehicleId, since);
        List<DwellEpisode> episodes = dwellEpisodeExtractor.extract(samples, minDwellMinutes);

        int learned = 0, skipped = 0;
        for (DwellEpisode episode : episodes) {
            if (parkingSessionRepository.existsByVehicleIdAndStartTime(vehicleId, episode.getStart())) {
                skipped++;
                continue;
            }
            LearnedLocation location = recordVisit(vehicleId, episode.getLatitude(), episode.getLongitude(),
                    episode.durationMinutes(), episode.getStart(), episode.getEnd());
            parkingSessionRepository.save(ParkingSession.builder()
                    .vehicleId(vehicleId)
                    .trigger(episode.getTrigger())
                    .status(ParkingSession.Status.CLOSED)
                    .startTime(episode.getStart())
                    .endTime(episode.getEnd())
                    .latitude(episode.getLatitude())
                    .longitude(episode.getLongitude())
                    .durationMinutes(episode.durationMinutes())
                    .locationId(location.getId())
                    .build());
            learned++;
        }

        log.info("CLUSTER: learned from {} day(s) of history for vehicle {} — samples: {}, episodes: {}, learned: {}, skipped: {}",
                days, vehicleId, samples.size(), episodes.size(), learned, skipped);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("vehicleId", vehicleId);
        summary.put("samples", samples.size());
        summary.put("episodes", episodes.size());
        summary.put("learned", learned);
        summary.put("skipped", skipped);
        return summary;
    }

    private Optional<NearbyLocation> nearestWithin(String vehicleId, double latitude, double longitude,
                                                   double radius) {
        return findNearby(latitude, longitude, radius, vehicleId).stream().findFirst();
    }

    private void updateVisitPattern(Long locationId, LocalDateTime arrival, long durationMinutes) {
        int hour = arrival.getHour();
        TimeOfDay bucket = TimeOfDay.ofHour(hour);
        LocationVisitPattern pattern = visitPatternRepository.findByLocationIdAndTimeBucket(locationId, bucket)
                .orElse(null);
        if (pattern == null) {
            pattern = LocationVisitPattern.builder()
                    .locationId(locationId)
                    .timeBucket(bucket)
                    .visitCount(1)
                    .typicalHour((double) hour)
                    .avgDurationMinutes((double) durationMinutes)
                    .build();
        } else {
            int n = pattern.getVisitCount();
            pattern.setTypicalHour((pattern.getTypicalHour() * n + hour) / (n + 1));
            pattern.setAvgDurationMinutes((pattern.getAvgDurationMinutes() * n + durationMinutes) / (n + 1));
            pattern.setVisitCount(n + 1);
        }
        visitPatternRepository.save(pattern);
    }

    private List<LocalDateTime> nearbySampleTimes(LearnedLocation location) {
        LocalDateTime reference = location.getLastVisit() != null ? location.getLastVisit() : LocalDateTime.now();
        double[] deltas = GeoUtil.boundingDeltas(location.getLatitude(), location.getRadiusMeters());
        return positionSampleRepository.findByVehicleIdAndTimestampAfterAndLatitudeBetweenAndLongitudeBetween(
                        location.getVehicleId(), reference.minusDays(historyDays),
                        location.getLatitude() - deltas[0], location.getLatitude() + deltas[0],
                        location.getLongitude() - deltas[1], location.getLongitude() + deltas[1])
                .stream()
                .filter(s -> !s.getTimestamp().isAfter(reference))
                .filter(s -> GeoUtil.isWithinRadius(s.getLatitude(), s.getLongitude(),
                        location.getLatitude(), location.getLongitude(), location.getRadiusMeters()))
                .map(PositionSample::getTimestamp)
                .toList();
    }

    private static LocalDateTime min(LocalDateTime a, LocalDateTime b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static LocalDateTime max(LocalDateTime a, LocalDateTime b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
