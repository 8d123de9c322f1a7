package com.koni.energy.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.energy.domain.event.AlertTriggered;
import com.koni.energy.domain.repository.FallbackEventRepository;
import com.koni.energy.infrastructure.messaging.KafkaPublishException;
import com.koni.energy.infrastructure.observability.AlertMetrics;
import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Replays alert notifications parked in the fallback table while Kafka was unavailable.
 * 
 * The replay process:
 * 1. Check that the circuit breaker is closed
 * 2. Read the parked notifications, oldest failure first
 * 3. Publish each one to Kafka
 * 4. Delete each notification once Kafka has acknowledged it
 * 
 * A notification that fails to publish stays in the table for the next replay.
 */
@Slf4j
@Service
public class FallbackReplayService {
    
    private static final int TIMEOUT_SECONDS = 10;

    private final FallbackEventRepository fallbackRepository;
    private final KafkaTemplate<String, AlertTriggered> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final AlertMetrics alertMetrics;
    private final String topic;

    public FallbackReplayService(
            FallbackEventRepository fallbackRepository,
            KafkaTemplate<String, AlertTriggered> kafkaTemplate,
            CircuitBreaker kafkaCircuitBreaker,
            ObjectMapper objectMapper,
            AlertMetrics alertMetrics,
            @Value("${energy.alerts.kafka.topic:alerts.triggered}") String topic) {
        this.fallbackRepository = fallbackRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreaker = kafkaCircuitBreaker;
        this.objectMapper = objectMapper;
        this.alertMetrics = alertMetrics;
        this.topic = topic;
    }
    
    /**
     * @return the number of notifications replayed, 0 if the circuit is not closed
     */
    public int replayEvents() {
        CircuitBreaker.State state = circuitBreaker.getState();
        if (state != CircuitBreaker.State.CLOSED) {
            log.warn("Cannot replay notifications: circuit breaker is in {} state", state);
            return 0;
        }
        
        List<FallbackEventEntity> fallbackEvents = fallbackRepository.findAll();
        if (fallbackEvents.isEmpty()) {
            log.info("No fallback notifications to replay");
            return 0;
        }
        
        log.info("Replaying {} fallback notifications", fallbackEvents.size());
        
        int successCount = 0;
        int failureCount = 0;
        
        for (FallbackEventEntity fallbackEvent : fallbackEvents) {
            try {
                AlertTriggered event = objectMapper.readValue(fallbackEvent.getPayload(), AlertTriggered.class);
                publishToKafka(event);
                fallbackRepository.delete(fallbackEvent.getEventId());
                alertMetrics.recordFallbackReplayed();
                successCount++;
                log.debug("Replayed fallback notification: eventId={}", fallbackEvent.getEventId());
            } catch (JsonProcessingException | KafkaPublishException e) {
                failureCount++;
                log.error("Failed to replay fallback notification: eventId={}, deviceId={}. It stays in the fallback table.", 
                        fallbackEvent.getEventId(), fallbackEvent.getDeviceId(), e);
            }
        }
        
        log.info("Fallback replay completed: {} succeeded, {} failed", successCount, failureCount);
        return successCount;
    }
    
    private void publishToKafka(AlertTriggered event) {
        try {
            SendResult<String, AlertTriggered> result = kafkaTemplate
                    .send(topic, event.getDeviceId().toString(), event)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Replayed notification sent: topic={}, partition={}, offset={}", 
                    topic, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaPublishException("Interrupted while replaying to Kafka", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new KafkaPublishException("Failed to publish event to Kafka: " + e.getMessage(), e);
        }
    }
}
