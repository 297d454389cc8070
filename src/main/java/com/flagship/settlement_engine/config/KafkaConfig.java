package com.flagship.settlement_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares one topic per aggregate type. Three partitions each; the publisher
 * keys by aggregate id so ordering holds per payment, ticket, refund or withdrawal.
 */
@Configuration
public class KafkaConfig {

    private final SettlementProperties.Kafka.Topics topics;

    public KafkaConfig(SettlementProperties properties) {
        this.topics = properties.getKafka().getTopics();
    }

    @Bean
    public NewTopic paymentsTopic() {
        return topic(topics.getPayments());
    }

    @Bean
    public NewTopic ticketsTopic() {
        return topic(topics.getTickets());
    }

    @Bean
    public NewTopic refundsTopic() {
        return topic(topics.getRefunds());
    }

    @Bean
    public NewTopic withdrawalsTopic() {
        return topic(topics.getWithdrawals());
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
