package com.eventhub.common.config;

import com.eventhub.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

/**
 * Auto-creates the lifecycle topics. Booking topics are keyed by event id, so their
 * partition count bounds per-event ordering parallelism for consumers.
 * Topics are declared whenever spring-kafka is present; KafkaAdmin creates them against
 * spring.kafka.bootstrap-servers on startup.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
public class KafkaTopicConfig {

    private static final short REPLICATION_FACTOR = 1;

    @Bean
    public NewTopic bookingCreatedTopic() {
        return buildTopic(Topics.BOOKING_CREATED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingUpdatedTopic() {
        return buildTopic(Topics.BOOKING_UPDATED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingCancelledTopic() {
        return buildTopic(Topics.BOOKING_CANCELLED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic mediaAttachedTopic() {
        return buildTopic(Topics.MEDIA_ATTACHED, Topics.PARTITIONS_MEDIA);
    }

    private NewTopic buildTopic(String name, int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }
}
