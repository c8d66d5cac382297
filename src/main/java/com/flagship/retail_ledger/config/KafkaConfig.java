package com.flagship.retail_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger event topic. Events are keyed by aggregate id, so every event for one sale,
 * item or counterparty lands on the same partition.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger:ledger-events}")
    private String ledgerTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
