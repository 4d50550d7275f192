package com.gocomet.seatshare.common.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A ride lifecycle change, published to the "ride-events" Kafka topic keyed
 * by rideId.
 *
 * Event flow:
 * PUBLISHED → STARTED → COMPLETED
 * (from PUBLISHED or STARTED) → CANCELLED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEvent {

    private String eventId;
    private UUID rideId;
    private UUID driverId;
    private EventType eventType;
    private Integer availableSeats;
    private Instant timestamp;

    public enum EventType {
        PUBLISHED,
        STARTED,
        COMPLETED,
        CANCELLED
    }

    public static RideEvent of(EventType type, UUID rideId, UUID driverId, Integer availableSeats) {
        return RideEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .rideId(rideId)
                .driverId(driverId)
                .eventType(type)
                .availableSeats(availableSeats)
                .timestamp(Instant.now())
                .build();
    }
}
