package com.koni.energy.infrastructure.messaging;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the alert notification topic. Spring Kafka's admin creates it on startup
 * when it does not exist yet.
 * 
 * Messages are keyed by device id, so notifications of one device stay ordered.
 */
@Configuration
public class KafkaTopicConfig {
    
    @Value("${energy.alerts.kafka.topic:alerts.triggered}")
    private String topicName;
    
    @Value("${energy.alerts.kafka.partitions:3}")
    private int partitions;
    
    @Value("${energy.alerts.kafka.replication-factor:1}")
    private short replicationFactor;
    
    @Bean
    public NewTopic alertsTriggeredTopic() {
        return TopicBuilder.name(topicName)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }
}
