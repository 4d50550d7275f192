package com.gocomet.seatshare.ride.event;

import com.gocomet.seatshare.common.event.RideEvent;
import com.gocomet.seatshare.ride.model.Ride;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes ride lifecycle changes to the "ride-events" Kafka topic.
 *
 * KEY = rideId. acks=all (configured in application.yml) for these business
 * events; a failed send is logged, never rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideEventProducer {

    private final KafkaTemplate<String, RideEvent> kafkaTemplate;

    @Value("${app.kafka.topics.ride-events}")
    private String topic;

    public void publish(RideEvent.EventType type, Ride ride) {
        RideEvent event = RideEvent.of(type, ride.getId(), ride.getDriver().getId(), ride.getAvailableSeats());
        try {
            kafkaTemplate.send(topic, event.getRideId().toString(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish RideEvent [{}] for ride {}",
                                    event.getEventType(), event.getRideId(), ex);
                        } else {
                            log.debug("Published RideEvent [{}] for ride {} → partition {}, offset {}",
                                    event.getEventType(),
                                    event.getRideId(),
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Could not hand RideEvent [{}] for ride {} to Kafka", event.getEventType(), event.getRideId(), e);
        }
    }
}
