package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.EventSeverity;
import com.fleetinsight.telemetry.entity.EventType;
import com.fleetinsight.telemetry.entity.PositionSample;
import com.fleetinsight.telemetry.entity.VehicleEvent;
import com.fleetinsight.telemetry.repository.PositionSampleRepository;
import com.fleetinsight.telemetry.service.detection.BatteryRule;
import com.fleetinsight.telemetry.service.detection.EventCandidate;
import com.fleetinsight.telemetry.service.detection.EventRecorder;
import com.fleetinsight.telemetry.service.detection.EventRule;
import com.fleetinsight.telemetry.service.detection.HarshBrakingRule;
import com.fleetinsight.telemetry.service.detection.SampleHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EventDetectionService.
 *
 * Test cases:
 *  1. failingRule_isolated_otherRulesStillRecorded
 *
 *  2. recordedEvents_publishedToLiveFeed
 *
 *  3. suppressedCandidate_notPublished
 *
 *  4. inOrderSamples_previousServedFromCache
 *
 *  5. lateSample_previousResolvedFromStore_cacheKeepsNewest
 *
 *  6. recorderFailure_loggedAndSkipped
 *
 *  7. lateSample_successorEventNoLongerHolds_retracted
 *     Speeds 100 → 50 delivered, then 80 arrives between them: the 100→50 harsh braking
 *     becomes 80→50 and is removed.
 *
 *  8. lateSample_successorNowFires_eventRecordedAndPublished
 *
 *  9. noStoredSuccessor_nothingReevaluated
 *
 * 10. cooldownLock_sharedPerVehicleAndType
 */
@ExtendWith(MockitoExtension.class)
class EventDetectionServiceTest {

    @Mock private EventRecorder eventRecorder;
    @Mock private SampleHistory sampleHistory;
    @Mock private PositionSampleRepository positionSampleRepository;
    @Mock private EventPublisher eventPublisher;
    @Mock private EventRule failingRule;

    private static final String VEHICLE = "V-300";
    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 3, 7, 0);

    // ── Helper builders ───────────────────────────────────────────────────────

    private EventDetectionService service(List<EventRule> rules) {
        return new EventDetectionService(rules, eventRecorder, sampleHistory, positionSampleRepository, eventPublisher);
    }

    private PositionSample sample(int minute, Integer battery) {
        return PositionSample.builder()
                .vehicleId(VEHICLE)
                .timestamp(T0.plusMinutes(minute))
                .latitude(12.97)
                .longitude(77.59)
                .speed(0.0)
                .ignitionOn(true)
                .batteryPercent(battery)
                .build();
    }

    private PositionSample moving(int second, double speed) {
        return PositionSample.builder()
                .vehicleId(VEHICLE)
                .timestamp(T0.plusSeconds(second))
                .latitude(12.97)
                .longitude(77.59)
                .speed(speed)
                .ignitionOn(true)
                .build();
    }

    private VehicleEvent event(EventType type) {
        return VehicleEvent.builder()
                .id(1L)
                .vehicleId(VEHICLE)
                .eventType(type)
                .severity(EventSeverity.WARNING)
                .createdAt(T0)
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("A throwing rule is skipped and the battery rule still records its event")
    void failingRule_isolated_otherRulesStillRecorded() {
        EventDetectionService service = service(List.of(failingRule, new BatteryRule(20, 10)));
        PositionSample previous = sample(0, 25);
        PositionSample current = sample(1, 18);
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(VEHICLE, current.getTimestamp()))
                .thenReturn(Optional.of(previous));
        when(failingRule.evaluate(any())).thenThrow(new IllegalStateException("boom"));
        when(eventRecorder.recordIfOutsideCooldown(eq(VEHICLE), eq(current.getTimestamp()), any(EventCandidate.class)))
                .thenReturn(Optional.of(event(EventType.LOW_BATTERY)));

        DetectionResult result = service.detect(current);

        assertThat(result.getPrevious()).isSameAs(previous);
        assertThat(result.getEvents()).extracting(VehicleEvent::getEventType)
                .containsExactly(EventType.LOW_BATTERY);
    }

    @Test
    @DisplayName("Recorded events are pushed to the live feed")
    void recordedEvents_publishedToLiveFeed() {
        EventDetectionService service = service(List.of(new BatteryRule(20, 10)));
        VehicleEvent critical = event(EventType.CRITICAL_BATTERY);
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(any(), any()))
                .thenReturn(Optional.empty());
        when(eventRecorder.recordIfOutsideCooldown(any(), any(), any())).thenReturn(Optional.of(critical));

        service.detect(sample(0, 5));

        verify(eventPublisher).publish(critical);
    }

    @Test
    @DisplayName("Candidate suppressed by cooldown → nothing published")
    void suppressedCandidate_notPublished() {
        EventDetectionService service = service(List.of(new BatteryRule(20, 10)));
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(any(), any()))
                .thenReturn(Optional.empty());
        when(eventRecorder.recordIfOutsideCooldown(any(), any(), any())).thenReturn(Optional.empty());

        DetectionResult result = service.detect(sample(0, 5));

        assertThat(result.getEvents()).isEmpty();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Second in-order sample → previous comes from the cache, store queried once")
    void inOrderSamples_previousServedFromCache() {
        EventDetectionService service = service(List.of());
        PositionSample first = sample(0, null);
        PositionSample second = sample(1, null);
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(VEHICLE, first.getTimestamp()))
                .thenReturn(Optional.empty());

        service.detect(first);
        DetectionResult result = service.detect(second);

        assertThat(result.getPrevious()).isSameAs(first);
        verify(positionSampleRepository, times(1))
                .findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(any(), any());
    }

    @Test
    @DisplayName("Late sample → predecessor read from the store; cache still holds the newest sample")
    void lateSample_previousResolvedFromStore_cacheKeepsNewest() {
        EventDetectionService service = service(List.of());
        PositionSample newest = sample(10, null);
        PositionSample older = sample(2, null);
        PositionSample storedPredecessor = sample(1, null);
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(VEHICLE, newest.getTimestamp()))
                .thenReturn(Optional.empty());
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(VEHICLE, older.getTimestamp()))
                .thenReturn(Optional.of(storedPredecessor));

        service.detect(newest);
        DetectionResult result = service.detect(older);

        assertThat(result.getPrevious()).isSameAs(storedPredecessor);
        assertThat(service.lastSample(VEHICLE)).containsSame(newest);
        verify(positionSampleRepository, never()).findTopByVehicleIdOrderByTimestampDesc(any());
    }

    @Test
    @DisplayName("Recorder throws → logged, detection completes without the event")
    void recorderFailure_loggedAndSkipped() {
        EventDetectionService service = service(List.of(new BatteryRule(20, 10)));
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(any(), any()))
                .thenReturn(Optional.empty());
        when(eventRecorder.recordIfOutsideCooldown(any(), any(), any()))
                .thenThrow(new IllegalStateException("db down"));

        DetectionResult result = service.detect(sample(0, 5));

        assertThat(result.getEvents()).isEmpty();
        verifyNoInteractions(eventPublisher);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Late samples: successor re-evaluation
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("100, 50, then 80 late between them → harsh braking recorded for 50 is retracted")
    void lateSample_successorEventNoLongerHolds_retracted() {
        EventDetectionService service = service(List.of(new HarshBrakingRule(40)));
        PositionSample fast = moving(0, 100);
        PositionSample slow = moving(60, 50);
        PositionSample late = moving(30, 80);
        VehicleEvent braking = VehicleEvent.builder().id(7L).vehicleId(VEHICLE)
                .eventType(EventType.HARSH_BRAKING).createdAt(slow.getTimestamp()).build();

        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(VEHICLE, fast.getTimestamp()))
                .thenReturn(Optional.empty());
        when(positionSampleRepository.findTopByVehicleIdAndTimestampBeforeOrderByTimestampDesc(VEHICLE, late.getTimestamp()))
                .thenReturn(Optional.of(fast));
        when(positionSampleRepository.findFirstByVehicleIdAndTimestampAfterOrderByTimestampAsc(VEHICLE, late.getTimestamp()))
                .thenReturn(Optional.of(slow));
        when(eventRecorder.recordIfOutsideCooldown(eq(VEHICLE), eq(slow.getTimestamp()), any()))
                .thenReturn(Optional.of(braking));
        when(eventRecorder.findRecordedAt(VEHICLE, slow.getTimestamp())).thenReturn(List.of(braking));

        service.detect(fast);
        assertThat(service.detect(slow).getEvents()).containsExactly(braking);
        assertThat(service.detect(late).getEvents()).isEmpty();
        List<VehicleEvent> added = service.reevaluateSuccessor(late);

        assertThat(added).isEmpty();
        verify(eventRecorder).retract(braking);
        verify(eventRecorder, times(1)).recordIfOutsideCooldown(any(), any(), any());
    }

    @Test
    @DisplayName("60, 30, then 90 late between them → 90→30 now brakes harshly; recorded for 30 and published")
    void lateSample_successorNowFires_eventRecordedAndPublished() {
        EventDetectionService service = service(List.of(new HarshBrakingRule(40)));
        PositionSample successor = moving(60, 30);
        PositionSample late = moving(30, 90);
        VehicleEvent braking = event(EventType.HARSH_BRAKING);
        when(positionSampleRepository.findFirstByVehicleIdAndTimestampAfterOrderByTimestampAsc(VEHICLE, late.getTimestamp()))
                .thenReturn(Optional.of(successor));
        when(eventRecorder.findRecordedAt(VEHICLE, successor.getTimestamp())).thenReturn(List.of());
        ArgumentCaptor<EventCandidate> candidate = ArgumentCaptor.forClass(EventCandidate.class);
        when(eventRecorder.recordIfOutsideCooldown(eq(VEHICLE), eq(successor.getTimestamp()), candidate.capture()))
                .thenReturn(Optional.of(braking));

        List<VehicleEvent> added = service.reevaluateSuccessor(late);

        assertThat(added).containsExactly(braking);
        assertThat(candidate.getValue().getValueBefore()).isEqualTo(90.0);
        assertThat(candidate.getValue().getValueAfter()).isEqualTo(30.0);
        verify(eventPublisher).publish(braking);
        verify(eventRecorder, never()).retract(any());
    }

    @Test
    @DisplayName("Nothing stored after the late sample → no rule runs, nothing retracted")
    void noStoredSuccessor_nothingReevaluated() {
        EventDetectionService service = service(List.of(failingRule));
        PositionSample late = moving(30, 80);
        when(positionSampleRepository.findFirstByVehicleIdAndTimestampAfterOrderByTimestampAsc(VEHICLE, late.getTimestamp()))
                .thenReturn(Optional.empty());

        assertThat(service.reevaluateSuccessor(late)).isEmpty();
        verifyNoInteractions(failingRule, eventRecorder, eventPublisher);
    }

    @Test
    @DisplayName("Same vehicle and type share one lock while it is held; other keys get their own")
    void cooldownLock_sharedPerVehicleAndType() {
        EventDetectionService service = service(List.of());

        ReentrantLock braking = service.lockFor(VEHICLE, EventType.HARSH_BRAKING);
        braking.lock();
        try {
            assertThat(service.lockFor(VEHICLE, EventType.HARSH_BRAKING)).isSameAs(braking);
            assertThat(service.lockFor(VEHICLE, EventType.OVERSPEEDING)).isNotSameAs(braking);
            assertThat(service.lockFor("V-301", EventType.HARSH_BRAKING)).isNotSameAs(braking);
        } finally {
            braking.unlock();
        }
    }
}
