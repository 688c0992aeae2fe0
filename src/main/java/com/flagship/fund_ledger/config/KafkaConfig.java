package com.flagship.fund_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Created on startup when the broker
 * allows it; partition count bounds consumer parallelism per topic.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.fund-allocations:fund-allocations}")
    private String allocationsTopic;

    @Value("${kafka.topic.settlements:worker-settlements}")
    private String settlementsTopic;

    @Bean
    public NewTopic fundAllocationsTopic() {
        return TopicBuilder.name(allocationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic settlementsTopic() {
        return TopicBuilder.name(settlementsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
