package com.fleetinsight.telemetry.service;

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
import com.fleetinsight.telemetry.service.location.DwellEpisodeExtractor;
import com.fleetinsight.telemetry.service.location.LocationClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LocationClusteringService.
 *
 * The learned-location and visit-pattern repositories are backed by in-memory
 * lists so that consecutive visits see each other's writes.
 *
 * Test cases:
 *  1. firstVisit_createsUnknownLocation
 *  2. secondVisitWithinRadius_mergesAtMidpoint
 *  3. visitOutsideRadius_newLocation
 *  4. mergeOrder_doesNotMatter
 *  5. twiceDailyStops_tenDays_classifiedFrequent
 *  6. findNearby_filtersByRadiusAndSortsNearestFirst
 *  7. labelLocation_manual_fullConfidence
 *  8. labelLocation_unknownId_notFound
 *  9. learnFromHistory_recordsEpisodeAndSkipsKnownOnes
 */
@ExtendWith(MockitoExtension.class)
class LocationClusteringServiceTest {

    @Mock private LearnedLocationRepository learnedLocationRepository;
    @Mock private LocationVisitPatternRepository visitPatternRepository;
    @Mock private ParkingSessionRepository parkingSessionRepository;
    @Mock private PositionSampleRepository positionSampleRepository;
    @Mock private LearnedLocationQueryService learnedLocationQueryService;

    private LocationClusteringService service;

    private final List<LearnedLocation> locations = new ArrayList<>();
    private final Map<TimeOfDay, LocationVisitPattern> patterns = new EnumMap<>(TimeOfDay.class);
    private final AtomicLong ids = new AtomicLong();

    private static final String VEHICLE = "V-700";
    private static final LocalDateTime DAY = LocalDateTime.of(2026, 2, 1, 0, 0);
    private static final double LAT = 12.9352;
    private static final double LON = 77.6245;

    @BeforeEach
    void setUp() {
        service = new LocationClusteringService(learnedLocationRepository, visitPatternRepository,
                parkingSessionRepository, positionSampleRepository, learnedLocationQueryService,
                new LocationClassifier(), new DwellEpisodeExtractor(2.0));
        ReflectionTestUtils.setField(service, "clusterRadiusMeters", 50.0);
        ReflectionTestUtils.setField(service, "nearbyRadiusMeters", 100.0);
        ReflectionTestUtils.setField(service, "minDwellMinutes", 15L);
        ReflectionTestUtils.setField(service, "historyDays", 30);

        lenient().when(learnedLocationRepository.findByVehicleIdAndLatitudeBetweenAndLongitudeBetween(
                anyString(), anyDouble(), anyDouble(), anyDouble(), anyDouble())).thenAnswer(inv -> {
            String vehicleId = inv.getArgument(0);
            double minLat = inv.getArgument(1), maxLat = inv.getArgument(2);
            double minLon = inv.getArgument(3), maxLon = inv.getArgument(4);
            return locations.stream()
                    .filter(l -> l.getVehicleId().equals(vehicleId))
                    .filter(l -> l.getLatitude() >= minLat && l.getLatitude() <= maxLat)
                    .filter(l -> l.getLongitude() >= minLon && l.getLongitude() <= maxLon)
                    .toList();
        });
        lenient().when(learnedLocationRepository.save(any(LearnedLocation.class))).thenAnswer(inv -> {
            LearnedLocation l = inv.getArgument(0);
            if (l.getId() == null) {
                l.setId(ids.incrementAndGet());
                locations.add(l);
            }
            return l;
        });
        lenient().when(visitPatternRepository.findByLocationIdAndTimeBucket(anyLong(), any()))
                .thenAnswer(inv -> Optional.ofNullable(patterns.get(inv.<TimeOfDay>getArgument(1))));
        lenient().when(visitPatternRepository.save(any(LocationVisitPattern.class))).thenAnswer(inv -> {
            LocationVisitPattern p = inv.getArgument(0);
            patterns.put(p.getTimeBucket(), p);
            return p;
        });
        lenient().when(visitPatternRepository.findByLocationId(anyLong()))
                .thenAnswer(inv -> new ArrayList<>(patterns.values()));
        lenient().when(positionSampleRepository.findByVehicleIdAndTimestampAfterAndLatitudeBetweenAndLongitudeBetween(
                anyString(), any(), anyDouble(), anyDouble(), anyDouble(), anyDouble())).thenReturn(List.of());
    }

    private void resetStore() {
        locations.clear();
        patterns.clear();
        ids.set(0);
    }

    private LearnedLocation visit(double lat, double lon, LocalDateTime arrival, long minutes) {
        return service.recordVisit(VEHICLE, lat, lon, minutes, arrival, arrival.plusMinutes(minutes));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Merging
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("First visit → new UNKNOWN location with one visit and confidence 0.05")
    void firstVisit_createsUnknownLocation() {
        LearnedLocation loc = visit(LAT, LON, DAY.withHour(9), 40);

        assertThat(loc.getId()).isEqualTo(1L);
        assertThat(loc.getLocationType()).isEqualTo(LocationType.UNKNOWN);
        assertThat(loc.getVisitCount()).isEqualTo(1);
        assertThat(loc.getTotalDurationMinutes()).isEqualTo(40L);
        assertThat(loc.getTypicalDurationMinutes()).isEqualTo(40);
        assertThat(loc.getConfidence()).isEqualTo(0.05);
        assertThat(loc.isAutoDetected()).isTrue();
        assertThat(patterns).containsOnlyKeys(TimeOfDay.MORNING);
        verify(learnedLocationQueryService).evict(VEHICLE);
    }

    @Test
    @DisplayName("Second visit 20 m away → merged, centroid at the midpoint, visit window widened")
    void secondVisitWithinRadius_mergesAtMidpoint() {
        visit(LAT, LON, DAY.withHour(9), 40);
        LearnedLocation merged = visit(LAT + 0.0002, LON, DAY.plusDays(1).withHour(18), 20);

        assertThat(locations).hasSize(1);
        assertThat(merged.getVisitCount()).isEqualTo(2);
        assertThat(merged.getLatitude()).isCloseTo(LAT + 0.0001, within(1e-9));
        assertThat(merged.getTotalDurationMinutes()).isEqualTo(60L);
        assertThat(merged.getTypicalDurationMinutes()).isEqualTo(30);
        assertThat(merged.getFirstVisit()).isEqualTo(DAY.withHour(9));
        assertThat(merged.getLastVisit()).isEqualTo(DAY.plusDays(1).withHour(18).plusMinutes(20));
        assertThat(patterns).containsOnlyKeys(TimeOfDay.MORNING, TimeOfDay.EVENING);
    }

    @Test
    @DisplayName("Visit 200 m away → separate location")
    void visitOutsideRadius_newLocation() {
        visit(LAT, LON, DAY.withHour(9), 40);
        visit(LAT + 0.0018, LON, DAY.withHour(13), 40);

        assertThat(locations).hasSize(2);
    }

    @Test
    @DisplayName("Two visits merged in either order → same centroid, counts and visit window")
    void mergeOrder_doesNotMatter() {
        LocalDateTime early = DAY.withHour(8);
        LocalDateTime late = DAY.plusDays(3).withHour(19);

        visit(LAT, LON, early, 25);
        LearnedLocation ab = visit(LAT + 0.0001, LON - 0.0001, late, 35);
        double abLat = ab.getLatitude(), abLon = ab.getLongitude();
        LocalDateTime abFirst = ab.getFirstVisit(), abLast = ab.getLastVisit();

        resetStore();
        visit(LAT + 0.0001, LON - 0.0001, late, 35);
        LearnedLocation ba = visit(LAT, LON, early, 25);

        assertThat(ba.getLatitude()).isEqualTo(abLat);
        assertThat(ba.getLongitude()).isEqualTo(abLon);
        assertThat(ba.getVisitCount()).isEqualTo(2);
        assertThat(ba.getTotalDurationMinutes()).isEqualTo(60L);
        assertThat(ba.getFirstVisit()).isEqualTo(abFirst);
        assertThat(ba.getLastVisit()).isEqualTo(abLast);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Classification
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("20-minute stops at 08:00 and 18:00 for ten days → FREQUENT with 20 visits")
    void twiceDailyStops_tenDays_classifiedFrequent() {
        LearnedLocation loc = null;
        for (int d = 0; d < 10; d++) {
            visit(LAT + (d % 2) * 0.00005, LON, DAY.plusDays(d).withHour(8), 20);
            loc = visit(LAT, LON + (d % 2) * 0.00005, DAY.plusDays(d).withHour(18), 20);
        }

        assertThat(locations).hasSize(1);
        assertThat(loc.getVisitCount()).isEqualTo(20);
        assertThat(loc.getLocationType()).isEqualTo(LocationType.FREQUENT);
        assertThat(loc.getConfidence()).isEqualTo(1.0);
        assertThat(patterns.get(TimeOfDay.MORNING).getVisitCount()).isEqualTo(10);
        assertThat(patterns.get(TimeOfDay.EVENING).getVisitCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Manually labelled location is not reclassified by later visits")
    void manualLabel_survivesLaterVisits() {
        LearnedLocation loc = visit(LAT, LON, DAY.withHour(8), 20);
        when(learnedLocationRepository.findById(loc.getId())).thenReturn(Optional.of(loc));
        service.labelLocation(loc.getId(), new LocationLabelRequest(LocationType.HOME, "Depot"));

        for (int d = 1; d < 6; d++) {
            loc = visit(LAT, LON, DAY.plusDays(d).withHour(8), 20);
        }

        assertThat(loc.getLocationType()).isEqualTo(LocationType.HOME);
        assertThat(loc.getConfidence()).isEqualTo(1.0);
        verify(visitPatternRepository, never()).findByLocationId(anyLong());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Lookups and labels
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("findNearby → only locations inside the radius, nearest first")
    void findNearby_filtersByRadiusAndSortsNearestFirst() {
        LearnedLocation far = stored(LAT + 0.0008, LON);    // ~89 m
        LearnedLocation near = stored(LAT + 0.0005, LON);   // ~56 m
        stored(LAT + 0.0030, LON);                          // ~334 m

        List<NearbyLocation> result = service.findNearby(LAT, LON, 100.0, VEHICLE);

        assertThat(result).extracting(NearbyLocation::getLocation).containsExactly(near, far);
        assertThat(result.get(0).getDistanceMeters()).isCloseTo(55.6, within(1.0));
    }

    @Test
    @DisplayName("findNearby with a non-positive radius → IllegalArgumentException")
    void findNearby_invalidRadius_rejected() {
        assertThatThrownBy(() -> service.findNearby(LAT, LON, 0.0, VEHICLE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("labelLocation → type set, autoDetected false, confidence 1.0")
    void labelLocation_manual_fullConfidence() {
        LearnedLocation loc = LearnedLocation.builder().id(42L).vehicleId(VEHICLE)
                .locationType(LocationType.PARKING).confidence(0.3).autoDetected(true).build();
        when(learnedLocationRepository.findById(42L)).thenReturn(Optional.of(loc));

        LearnedLocation labelled = service.labelLocation(42L, new LocationLabelRequest(LocationType.WORK, "Office"));

        assertThat(labelled.getLocationType()).isEqualTo(LocationType.WORK);
        assertThat(labelled.getCustomLabel()).isEqualTo("Office");
        assertThat(labelled.isAutoDetected()).isFalse();
        assertThat(labelled.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("labelLocation with an unknown id → ResourceNotFoundException")
    void labelLocation_unknownId_notFound() {
        when(learnedLocationRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.labelLocation(99L, new LocationLabelRequest(LocationType.HOME, null)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // History replay
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("learnFromHistory → new episode recorded as a CLOSED session, known episode skipped")
    void learnFromHistory_recordsEpisodeAndSkipsKnownOnes() {
        LocalDateTime t = DAY.withHour(7);
        List<PositionSample> samples = List.of(
                sample(t, true, 40), sample(t.plusMinutes(1), false, 0), sample(t.plusMinutes(31), true, 30),
                sample(t.plusHours(5), false, 0), sample(t.plusHours(6), true, 35));
        when(positionSampleRepository.findByVehicleIdAndTimestampAfterOrderByTimestampAsc(eq(VEHICLE), any()))
                .thenReturn(samples);
        when(parkingSessionRepository.existsByVehicleIdAndStartTime(VEHICLE, t.plusMinutes(1))).thenReturn(false);
        when(parkingSessionRepository.existsByVehicleIdAndStartTime(VEHICLE, t.plusHours(5))).thenReturn(true);

        Map<String, Object> summary = service.learnFromHistory(VEHICLE, 30);

        assertThat(summary).containsEntry("episodes", 2).containsEntry("learned", 1).containsEntry("skipped", 1);
        ArgumentCaptor<ParkingSession> captor = ArgumentCaptor.forClass(ParkingSession.class);
        verify(parkingSessionRepository).save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(ParkingSession.Status.CLOSED);
        assertThat(captor.getValue().getDurationMinutes()).isEqualTo(30L);
        assertThat(captor.getValue().getLocationId()).isEqualTo(1L);
        assertThat(locations).hasSize(1);
    }

    @Test
    @DisplayName("learnFromHistory with days <= 0 → IllegalArgumentException")
    void learnFromHistory_invalidDays_rejected() {
        assertThatThrownBy(() -> service.learnFromHistory(VEHICLE, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private LearnedLocation stored(double lat, double lon) {
        LearnedLocation l = LearnedLocation.builder()
                .id(ids.incrementAndGet())
                .vehicleId(VEHICLE)
                .latitude(lat)
                .longitude(lon)
                .radiusMeters(50.0)
                .locationType(LocationType.UNKNOWN)
                .visitCount(1)
                .totalDurationMinutes(30L)
                .autoDetected(true)
                .build();
        locations.add(l);
        return l;
    }

    private PositionSample sample(LocalDateTime at, boolean ignition, double speed) {
        return PositionSample.builder()
                .vehicleId(VEHICLE)
                .timestamp(at)
                .latitude(LAT)
                .longitude(LON)
                .ignitionOn(ignition)
                .speed(speed)
                .build();
    }
}
