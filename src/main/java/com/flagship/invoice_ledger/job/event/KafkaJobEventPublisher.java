package com.flagship.invoice_ledger.job.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Publishes job events to Kafka.
 *
 * - Job ID is the record key, so events of one job stay on one partition
 * - The event type and correlation ID travel as headers
 * - Sends are asynchronous; failures are logged and never reach the job worker
 */
@Slf4j
public class KafkaJobEventPublisher implements JobEventPublisher {

    public static final String EVENT_TYPE_HEADER = "eventType";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaJobEventPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    @Override
    public void publish(JobEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {} for job {}", event.getEventType(), event.getJobId(), e);
            return;
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.getJobId().toString(), payload);
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        String correlationId = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
        if (correlationId != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER, correlationId.getBytes(StandardCharsets.UTF_8));
        }

        try {
            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish {} for job {}: {}", event.getEventType(), event.getJobId(), ex.getMessage());
                } else {
                    log.debug("Published event: eventId={}, topic={}, partition={}, offset={}",
                        event.getEventId(),
                        result.getRecordMetadata().topic(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Failed to hand {} for job {} to Kafka: {}", event.getEventType(), event.getJobId(), e.getMessage());
        }
    }
}
