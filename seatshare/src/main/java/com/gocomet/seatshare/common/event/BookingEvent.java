package com.gocomet.seatshare.common.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A booking state change, published to the "booking-events" Kafka topic.
 *
 * Keyed by rideId rather than bookingId: every event touching one ride's seat
 * inventory lands in the same partition, in commit order.
 *
 * Event flow:
 * REQUESTED → ACCEPTED → PICKED_UP → COMPLETED
 * REQUESTED → REJECTED
 * (REQUESTED | ACCEPTED) → CANCELLED
 * SEATS_CHANGED may follow REQUESTED or ACCEPTED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingEvent {

    private String eventId;
    private UUID bookingId;
    private UUID rideId;
    private UUID riderId;
    private EventType eventType;
    private Integer numberOfSeats;
    private Instant timestamp;
    private String metadata;

    public enum EventType {
        REQUESTED,
        ACCEPTED,
        REJECTED,
        CANCELLED,
        SEATS_CHANGED,
        PICKED_UP,
        COMPLETED
    }

    public static BookingEvent of(EventType type, UUID bookingId, UUID rideId, UUID riderId,
                                  Integer numberOfSeats, String metadata) {
        return BookingEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .bookingId(bookingId)
                .rideId(rideId)
                .riderId(riderId)
                .eventType(type)
                .numberOfSeats(numberOfSeats)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
    }
}
