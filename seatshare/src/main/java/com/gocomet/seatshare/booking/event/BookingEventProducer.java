package com.gocomet.seatshare.booking.event;

import com.gocomet.seatshare.booking.model.Booking;
import com.gocomet.seatshare.common.event.BookingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes booking state changes to the "booking-events" Kafka topic.
 *
 * KEY = rideId, so consumers see the events of one ride's inventory in order.
 * Publishing is best-effort: a broker failure is logged and never undoes the
 * transition that produced the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingEventProducer {

    private final KafkaTemplate<String, BookingEvent> kafkaTemplate;

    @Value("${app.kafka.topics.booking-events}")
    private String topic;

    public void publish(BookingEvent.EventType type, Booking booking) {
        publish(type, booking, null);
    }

    public void publish(BookingEvent.EventType type, Booking booking, String metadata) {
        publish(BookingEvent.of(type, booking.getId(), booking.getRide().getId(), booking.getRider().getId(),
                booking.getNumberOfSeats(), metadata));
    }

    private void publish(BookingEvent event) {
        String key = event.getRideId().toString();
        try {
            kafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish BookingEvent [{}] for booking {}",
                                    event.getEventType(), event.getBookingId(), ex);
                        } else {
                            log.debug("Published BookingEvent [{}] for booking {} → partition {}, offset {}",
                                    event.getEventType(),
                                    event.getBookingId(),
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Could not hand BookingEvent [{}] for booking {} to Kafka",
                    event.getEventType(), event.getBookingId(), e);
        }
    }
}
