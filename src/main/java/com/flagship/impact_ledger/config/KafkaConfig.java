package com.flagship.impact_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger facts consumed by the certificate, email and export services.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.transactions:impact-transactions}")
    private String transactionsTopic;

    /**
     * Keyed by transaction id, so events for one transaction stay on one partition.
     */
    @Bean
    public NewTopic transactionsTopic() {
        return TopicBuilder.name(transactionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
