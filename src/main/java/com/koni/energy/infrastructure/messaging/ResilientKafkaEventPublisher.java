package com.koni.energy.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.energy.application.port.EventPublisher;
import com.koni.energy.domain.event.AlertTriggered;
import com.koni.energy.domain.repository.FallbackEventRepository;
import com.koni.energy.infrastructure.observability.AlertMetrics;
import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Kafka implementation of the EventPublisher port guarded by a circuit breaker.
 * 
 * Features:
 * - Uses deviceId as partition key to keep notifications of a device ordered
 * - Stores the notification in the fallback table when the circuit is open or a send fails
 * - Logs circuit breaker state changes
 * 
 * Circuit Breaker States:
 * - CLOSED: notifications go to Kafka
 * - OPEN: notifications go straight to the fallback table
 * - HALF_OPEN: a few notifications are sent to probe recovery
 */
@Slf4j
@Service
public class ResilientKafkaEventPublisher implements EventPublisher {
    
    private static final int TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, AlertTriggered> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final FallbackEventRepository fallbackRepository;
    private final ObjectMapper objectMapper;
    private final AlertMetrics alertMetrics;
    private final Clock clock;
    private final String topic;
    
    public ResilientKafkaEventPublisher(
            KafkaTemplate<String, AlertTriggered> kafkaTemplate,
            CircuitBreaker kafkaCircuitBreaker,
            FallbackEventRepository fallbackRepository,
            ObjectMapper objectMapper,
            AlertMetrics alertMetrics,
            Clock clock,
            @Value("${energy.alerts.kafka.topic:alerts.triggered}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreaker = kafkaCircuitBreaker;
        this.fallbackRepository = fallbackRepository;
        this.objectMapper = objectMapper;
        this.alertMetrics = alertMetrics;
        this.clock = clock;
        this.topic = topic;
        
        registerCircuitBreakerEventListeners();
    }
    
    /**
     * Publishes the notification, or parks it in the fallback table.
     * 
     * @param event the notification to publish
     * @throws IllegalArgumentException if event is null
     */
    @Override
    @Observed(name = "kafka.publish", contextualName = "alert-triggered-publish")
    public void publish(AlertTriggered event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        
        log.debug("Publishing AlertTriggered: alertEventId={}, deviceId={}", 
                event.getAlertEventId(), event.getDeviceId());
        
        Supplier<Void> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, () -> {
            publishToKafka(event);
            return null;
        });
        
        try {
            decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker is OPEN, using fallback: alertEventId={}, eventId={}", 
                    event.getAlertEventId(), event.getEventId());
            handleFallback(event);
        } catch (KafkaPublishException e) {
            log.warn("Kafka publish failed (circuit breaker recorded), using fallback: alertEventId={}, eventId={}", 
                    event.getAlertEventId(), event.getEventId());
            handleFallback(event);
        }
    }
    
    private void publishToKafka(AlertTriggered event) {
        String key = event.getDeviceId().toString();
        
        try {
            CompletableFuture<SendResult<String, AlertTriggered>> future = 
                    kafkaTemplate.send(topic, key, event);
            SendResult<String, AlertTriggered> result = future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            
            log.info("Published alert notification: topic={}, partition={}, offset={}, alertEventId={}", 
                    topic, 
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getAlertEventId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaPublishException("Interrupted while publishing to Kafka", e);
        } catch (Exception e) {
            log.error("Kafka publish failed: alertEventId={}, eventId={}", 
                    event.getAlertEventId(), event.getEventId(), e);
            throw new KafkaPublishException("Failed to publish event to Kafka: " + e.getMessage(), e);
        }
    }
    
    /**
     * Stores the notification for a later replay. The alert event itself is already
     * committed, so a failure here is logged and not rethrown.
     */
    private void handleFallback(AlertTriggered event) {
        try {
            FallbackEventEntity fallbackEvent = new FallbackEventEntity(
                    event.getEventId(),
                    event.getDeviceId(),
                    objectMapper.writeValueAsString(event),
                    Instant.now(clock)
            );
            fallbackRepository.save(fallbackEvent);
            alertMetrics.recordFallbackStored();
            
            log.info("Notification stored in fallback table: eventId={}, alertEventId={}", 
                    event.getEventId(), event.getAlertEventId());
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("CRITICAL: Notification lost, fallback store failed: eventId={}, alertEventId={}", 
                    event.getEventId(), event.getAlertEventId(), e);
        }
    }
    
    private void registerCircuitBreakerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> 
                    log.warn("Circuit breaker state transition: {} -> {} (failure rate: {}%, slow call rate: {}%)",
                            event.getStateTransition().getFromState(),
                            event.getStateTransition().getToState(),
                            circuitBreaker.getMetrics().getFailureRate(),
                            circuitBreaker.getMetrics().getSlowCallRate()))
                .onError(event -> 
                    log.warn("Circuit breaker recorded error: duration={}ms, error={}", 
                            event.getElapsedDuration().toMillis(),
                            event.getThrowable().getClass().getSimpleName()))
                .onCallNotPermitted(event -> 
                    log.warn("Circuit breaker call not permitted (circuit is OPEN)"));
    }
}
