package com.gocomet.seatshare.notification.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Best-effort push to connected clients. Delivery failures are logged and
 * never propagate into the booking transition that triggered them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Notify a rider about booking updates.
     * Frontend subscribes to: /topic/rider/{riderId}
     */
    public void notifyRider(UUID riderId, String eventType, Object payload) {
        send("/topic/rider/" + riderId, riderId, eventType, payload);
    }

    /**
     * Notify a driver about booking requests and changes.
     * Frontend subscribes to: /topic/driver/{driverId}
     */
    public void notifyDriver(UUID driverId, String eventType, Object payload) {
        send("/topic/driver/" + driverId, driverId, eventType, payload);
    }

    private void send(String destination, UUID recipientId, String eventType, Object payload) {
        Map<String, Object> message = Map.of(
                "eventType", eventType,
                "payload", payload
        );
        try {
            messagingTemplate.convertAndSend(destination, (Object) message);
            log.debug("Notified {} with event: {}", recipientId, eventType);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} notification to {}: {}", eventType, recipientId, e.getMessage(), e);
        }
    }
}
