package com.gocomet.seatshare.booking.event;

import com.gocomet.seatshare.common.event.BookingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Audit trail of the booking event stream.
 *
 * Consumer group: "booking-audit". Events are keyed by rideId, so within a
 * partition this consumer sees each ride's seat movements in commit order.
 */
@Service
@Slf4j
public class BookingEventConsumer {

    @KafkaListener(topics = "${app.kafka.topics.booking-events}", groupId = "booking-audit")
    public void consume(
            @Payload BookingEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        log.info("BookingEvent [{}] bookingId={}, rideId={}, riderId={}, seats={} | partition={}, offset={}",
                event.getEventType(),
                event.getBookingId(),
                event.getRideId(),
                event.getRiderId(),
                event.getNumberOfSeats(),
                partition,
                offset);

        switch (event.getEventType()) {
            case ACCEPTED -> log.info("   ↳ {} seat(s) reserved on ride {}", event.getNumberOfSeats(), event.getRideId());
            case CANCELLED -> log.info("   ↳ Booking {} cancelled ({})", event.getBookingId(), event.getMetadata());
            case SEATS_CHANGED -> log.info("   ↳ Booking {} seat change: {}", event.getBookingId(), event.getMetadata());
            case PICKED_UP -> log.info("   ↳ Rider {} picked up on ride {}", event.getRiderId(), event.getRideId());
            default -> log.debug("   ↳ Event type {} received", event.getEventType());
        }
    }
}
