package com.flagship.split_escrow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String settlementTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Events are keyed by aggregate id, so per-aggregate ordering holds
     * across partitions.
     */
    @Bean
    public NewTopic settlementEventsTopic() {
        return TopicBuilder.name(settlementTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
