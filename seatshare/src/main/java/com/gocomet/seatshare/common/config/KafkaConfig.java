package com.gocomet.seatshare.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic definitions.
 *
 * Topics:
 * ride-events: ride lifecycle (published, started, completed, cancelled); keyed by rideId
 * booking-events: booking transitions and seat movements; keyed by rideId
 *
 * Partition count is 2 for local dev. Increase significantly for production.
 */
@Configuration
public class KafkaConfig {

    @Value("${app.kafka.topics.ride-events}")
    private String rideEventsTopic;

    @Value("${app.kafka.topics.booking-events}")
    private String bookingEventsTopic;

    @Bean
    public NewTopic rideEventsTopic() {
        return TopicBuilder.name(rideEventsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic bookingEventsTopic() {
        return TopicBuilder.name(bookingEventsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }
}
