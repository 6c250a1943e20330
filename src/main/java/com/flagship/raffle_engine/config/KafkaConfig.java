package com.flagship.raffle_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.raffles:raffles}")
    private String rafflesTopic;

    @Value("${kafka.topic.payouts:payouts}")
    private String payoutsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic rafflesTopic() {
        return TopicBuilder.name(rafflesTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic payoutsTopic() {
        return TopicBuilder.name(payoutsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
