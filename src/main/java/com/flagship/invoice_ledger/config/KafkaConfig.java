package com.flagship.invoice_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.job.event.JobEventPublisher;
import com.flagship.invoice_ledger.job.event.KafkaJobEventPublisher;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Kafka wiring for job events. Only active with {@code jobs.events.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "jobs.events.enabled", havingValue = "true")
public class KafkaConfig {

    /**
     * Creates the job events topic if it doesn't exist.
     * Uses 3 partitions; the job ID key keeps one job's events in order.
     */
    @Bean
    public NewTopic jobEventsTopic(JobProperties properties) {
        return TopicBuilder.name(properties.getEvents().getTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public JobEventPublisher kafkaJobEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                                    ObjectMapper objectMapper,
                                                    JobProperties properties) {
        return new KafkaJobEventPublisher(kafkaTemplate, objectMapper, properties.getEvents().getTopic());
    }
}
