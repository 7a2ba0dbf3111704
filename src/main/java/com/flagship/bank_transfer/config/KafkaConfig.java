package com.flagship.bank_transfer.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the transfer events topic. Only active alongside the outbox publisher.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.transfers:bank.transfers}")
    private String transfersTopic;

    /**
     * Partitioned by transfer id, so three partitions keep per-transfer ordering.
     */
    @Bean
    public NewTopic transfersTopic() {
        return TopicBuilder.name(transfersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
