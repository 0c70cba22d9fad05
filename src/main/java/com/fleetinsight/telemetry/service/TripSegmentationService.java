package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.Trip;
import com.fleetinsight.telemetry.entity.TripSource;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import com.fleetinsight.telemetry.repository.TripRepository;
import com.fleetinsight.telemetry.service.segmentation.TripMetrics;
import com.fleetinsight.telemetry.service.segmentation.TripScan;
import com.fleetinsight.telemetry.service.segmentation.TripSegment;
import com.fleetinsight.telemetry.service.segmentation.TripSegmentationStrategy;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Trip Segmenter.
 *
 * Every registered strategy writes its own trips, tagged by source.
 *
 * In-order samples resume from a per-(vehicle, source) cursor: the first sample
 * of the run still open, or just after the last sample when nothing is open.
 * Only the samples from there on are read and only newly closed trips are
 * written. A late sample, or a cursor missing after a restart, replays from the
 * end of the last closed trip instead, so both paths converge to the same trip set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripSegmentationService {

    private final List<TripSegmentationStrategy> strategies;
    private final TripMetrics tripMetrics;
    private final TripRepository tripRepository;
    private final PositionSampleRepository positionSampleRepository;

    private final Cache<String, ReplayCursor> cursors = Caffeine.newBuilder()
            .maximumSize(50_000)
            .expireAfterAccess(Duration.ofHours(12))
            .build();

    /**
     * Brings each strategy's trips up to date with a newly stored sample.
     * Called by ingestion after every stored sample.
     *
     * @return trips newly written by this call, all strategies together
     */
    @Transactional
    public List<Trip> onSample(PositionSample sample) {
        List<Trip> written = new ArrayList<>();
        try {
            for (TripSegmentationStrategy strategy : strategies) {
                ReplayCursor cursor = cursors.getIfPresent(cursorKey(sample.getVehicleId(), strategy));
                if (cursor != null && cursor.precedes(sample.getTimestamp())) {
                    written.addAll(resumeFromCursor(sample.getVehicleId(), strategy, cursor));
                } else {
                    written.addAll(replayFromLastClosedTrip(sample.getVehicleId(), strategy, sample.getTimestamp()));
                }
            }
        } catch (RuntimeException e) {
            // the transaction rolls back, so the cursors may now be ahead of the stored trips
            invalidateCursors(sample.getVehicleId());
            throw e;
        }
        return written;
    }

    /**
     * Deletes and re-derives every trip of the vehicle that starts inside [from, to].
     */
    @Transactional
    public List<Trip> resegment(String vehicleId, LocalDateTime from, LocalDateTime to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        List<PositionSample> samples =
                positionSampleRepository.findByVehicleIdAndTimestampBetweenOrderByTimestampAsc(vehicleId, from, to);
        invalidateCursors(vehicleId);

        List<Trip> written = new ArrayList<>();
        for (TripSegmentationStrategy strategy : strategies) {
            int removed = tripRepository.deleteStartingBetween(vehicleId, strategy.source(), from, to);
            List<Trip> trips = tripRepository.saveAll(buildTrips(vehicleId, strategy, samples));
            written.addAll(trips);
            log.info("TRIPS: resegmented vehicle {} [{} .. {}] with {} — removed {}, wrote {}",
                    vehicleId, from, to, strategy.source(), removed, trips.size());
        }
        return written;
    }

    /**
     * Trips starting inside [from, to], oldest first. A null source returns both views.
     */
    @Transactional(readOnly = true)
    public List<Trip> findTrips(String vehicleId, LocalDateTime from, LocalDateTime to, TripSource source) {
        if (source == null) {
            return tripRepository.findByVehicleIdAndStartTimeBetweenOrderByStartTimeAsc(vehicleId, from, to);
        }
        return tripRepository.findByVehicleIdAndSourceMethodAndStartTimeBetweenOrderByStartTimeAsc(
                vehicleId, source, from, to);
    }

    /** Pure: segment the given ordered samples with one strategy and compute aggregates */
    public List<Trip> buildTrips(String vehicleId, TripSegmentationStrategy strategy, List<PositionSample> samples) {
        List<PositionSample> ordered = samples.stream()
                .sorted(Comparator.comparing(PositionSample::getTimestamp))
                .toList();
        return toTrips(vehicleId, strategy, strategy.segment(ordered));
    }

    private List<Trip> toTrips(String vehicleId, TripSegmentationStrategy strategy, List<TripSegment> segments) {
        List<Trip> trips = new ArrayList<>();
        for (TripSegment segment : segments) {
            Optional<Trip> trip = tripMetrics.toTrip(vehicleId, strategy.source(), segment);
            if (trip.isPresent()) {
                trips.add(trip.get());
            } else {
                log.debug("TRIPS: discarded {} segment for vehicle {} starting {} (zero duration or below noise floor)",
                        strategy.source(), vehicleId, segment.first().getTimestamp());
            }
        }
        return trips;
    }

    private List<Trip> resumeFromCursor(String vehicleId, TripSegmentationStrategy strategy, ReplayCursor cursor) {
        List<PositionSample> samples = cursor.isInclusive()
                ? positionSampleRepository.findByVehicleIdAndTimestampGreaterThanEqualOrderByTimestampAsc(
                        vehicleId, cursor.getTime())
                : positionSampleRepository.findByVehicleIdAndTimestampAfterOrderByTimestampAsc(vehicleId, cursor.getTime());

        TripScan scan = strategy.scan(samples);
        advanceCursor(vehicleId, strategy, scan, samples);
        if (scan.getClosed().isEmpty()) {
            return List.of();
        }
        // segments closed past the cursor are all new: earlier trips end before it
        List<Trip> saved = tripRepository.saveAll(toTrips(vehicleId, strategy, scan.getClosed()));
        log.debug("TRIPS: {} new {} trip(s) for vehicle {} from cursor {}",
                saved.size(), strategy.source(), vehicleId, cursor.getTime());
        return saved;
    }

    private List<Trip> replayFromLastClosedTrip(String vehicleId, TripSegmentationStrategy strategy,
                                                LocalDateTime sampleTime) {
        Optional<Trip> anchor = tripRepository.findTopByVehicleIdAndSourceMethodAndEndTimeBeforeOrderByEndTimeDesc(
                vehicleId, strategy.source(), sampleTime);

        List<PositionSample> samples;
        if (anchor.isPresent()) {
            LocalDateTime resumeAfter = anchor.get().getEndTime();
            samples = positionSampleRepository.findByVehicleIdAndTimestampAfterOrderByTimestampAsc(vehicleId, resumeAfter);
            tripRepository.deleteStartingAfter(vehicleId, strategy.source(), resumeAfter);
        } else {
            samples = positionSampleRepository.findByVehicleIdOrderByTimestampAsc(vehicleId);
            tripRepository.deleteAllForSource(vehicleId, strategy.source());
        }

        TripScan scan = strategy.scan(samples);
        advanceCursor(vehicleId, strategy, scan, samples);
        List<Trip> trips = toTrips(vehicleId, strategy, scan.getClosed());
        if (trips.isEmpty()) {
            return trips;
        }
        List<Trip> saved = tripRepository.saveAll(trips);
        log.debug("TRIPS: {} {} trip(s) for vehicle {} after replay from {}",
                saved.size(), strategy.source(), vehicleId,
                anchor.map(Trip::getEndTime).map(Object::toString).orElse("first sample"));
        return saved;
    }

    private void advanceCursor(String vehicleId, TripSegmentationStrategy strategy, TripScan scan,
                               List<PositionSample> samples) {
        String key = cursorKey(vehicleId, strategy);
        if (scan.openRun().isPresent()) {
            cursors.put(key, new ReplayCursor(scan.getOpenRunStart().getTimestamp(), true));
        } else if (!samples.isEmpty()) {
            cursors.put(key, new ReplayCursor(samples.get(samples.size() - 1).getTimestamp(), false));
        }
    }

    private void invalidateCursors(String vehicleId) {
        strategies.forEach(strategy -> cursors.invalidate(cursorKey(vehicleId, strategy)));
    }

    private static String cursorKey(String vehicleId, TripSegmentationStrategy strategy) {
        return vehicleId + "|" + strategy.source();
    }

    /** Where the next in-order replay starts: at {@code time} when inclusive, otherwise just after it */
    @Getter
    @AllArgsConstructor
    static final class ReplayCursor {

        private final LocalDateTime time;
        private final boolean inclusive;

        /** True when a sample at {@code sampleTime} lies past the cursor, i.e. arrived in order */
        boolean precedes(LocalDateTime sampleTime) {
            return sampleTime.isAfter(time);
        }
    }
}
