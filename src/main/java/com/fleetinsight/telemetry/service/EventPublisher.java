package com.fleetinsight.telemetry.service;

import com.fleetinsight.telemetry.entity.VehicleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes every recorded event to /topic/vehicle-events so dashboards can react
 * without polling. Delivery is best effort: a broker failure never undoes the
 * recorded event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventPublisher {

    public static final String EVENTS_TOPIC = "/topic/vehicle-events";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(VehicleEvent event) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("id", event.getId());
        msg.put("vehicleId", event.getVehicleId());
        msg.put("eventType", event.getEventType().name());
        msg.put("severity", event.getSeverity().name());
        msg.put("title", event.getTitle());
        msg.put("description", event.getDescription());
        msg.put("latitude", event.getLatitude());
        msg.put("longitude", event.getLongitude());
        msg.put("createdAt", event.getCreatedAt() != null ? event.getCreatedAt().toString() : null);
        try {
            messagingTemplate.convertAndSend(EVENTS_TOPIC, msg);
            log.debug("WS vehicle-event: {} for vehicle {}", event.getEventType(), event.getVehicleId());
        } catch (MessagingException e) {
            log.warn("WS: failed to push {} for vehicle {}: {}",
                    event.getEventType(), event.getVehicleId(), e.getMessage());
        }
    }
}
