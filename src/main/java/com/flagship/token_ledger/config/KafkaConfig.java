package com.flagship.token_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for ledger event forwarding.
 * Only active when {@code ledger.events.kafka.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.events.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${ledger.events.kafka.topic:ledger-events}")
    private String ledgerEventsTopic;

    /**
     * Creates the ledger events topic if it doesn't exist.
     * A single account keys every record, so one partition keeps ordering.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
