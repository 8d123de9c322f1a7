package com.koni.energy.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.koni.energy.domain.event.AlertTriggered;
import com.koni.energy.domain.repository.FallbackEventRepository;
import com.koni.energy.infrastructure.observability.AlertMetrics;
import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;
import com.koni.energy.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ResilientKafkaEventPublisher.
 * Tests partition keys, fallback storage and circuit breaker behavior.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class ResilientKafkaEventPublisherTest {

    private static final String TOPIC = "alerts.triggered";
    private static final Instant NOW = Instant.parse("2025-01-31T12:00:00Z");

    @Mock
    private KafkaTemplate<String, AlertTriggered> kafkaTemplate;

    @Mock
    private FallbackEventRepository fallbackRepository;

    @Mock
    private AlertMetrics alertMetrics;

    private CircuitBreaker circuitBreaker;
    private ObjectMapper objectMapper;
    private ResilientKafkaEventPublisher publisher;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.of("kafka", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50.0f)
                .build());
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        publisher = new ResilientKafkaEventPublisher(kafkaTemplate, circuitBreaker, fallbackRepository,
                objectMapper, alertMetrics, Clock.fixed(NOW, ZoneOffset.UTC), TOPIC);
    }

    private AlertTriggered notification(UUID deviceId) {
        return new AlertTriggered(UUID.randomUUID(), 1L, UUID.randomUUID(), UUID.randomUUID(), "High load",
                "threshold", "medium", deviceId, "power_w gt 1000", 1500.0, NOW);
    }

    private CompletableFuture<SendResult<String, AlertTriggered>> sent(AlertTriggered event) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(
                new SendResult<>(new ProducerRecord<>(TOPIC, event.getDeviceId().toString(), event), metadata));
    }

    private CompletableFuture<SendResult<String, AlertTriggered>> failed() {
        CompletableFuture<SendResult<String, AlertTriggered>> future = new CompletableFuture<>();
        future.completeExceptionally(new RuntimeException("Kafka connection failed"));
        return future;
    }

    @Test
    void shouldPublishWithDeviceIdAsPartitionKey() {
        // Given
        UUID deviceId = UUID.randomUUID();
        AlertTriggered event = notification(deviceId);
        when(kafkaTemplate.send(TOPIC, deviceId.toString(), event)).thenReturn(sent(event));

        // When
        publisher.publish(event);

        // Then
        verify(kafkaTemplate).send(eq(TOPIC), eq(deviceId.toString()), eq(event));
        verifyNoInteractions(fallbackRepository);
    }

    @Test
    void shouldStoreNotificationInFallbackWhenSendFails() throws Exception {
        // Given
        AlertTriggered event = notification(UUID.randomUUID());
        when(kafkaTemplate.send(any(), any(), any())).thenReturn(failed());

        // When
        publisher.publish(event);

        // Then
        ArgumentCaptor<FallbackEventEntity> captor = ArgumentCaptor.forClass(FallbackEventEntity.class);
        verify(fallbackRepository).save(captor.capture());
        FallbackEventEntity stored = captor.getValue();
        assertThat(stored.getEventId()).isEqualTo(event.getEventId());
        assertThat(stored.getDeviceId()).isEqualTo(event.getDeviceId());
        assertThat(stored.getFailedAt()).isEqualTo(NOW);
        assertThat(objectMapper.readValue(stored.getPayload(), AlertTriggered.class)).isEqualTo(event);
        verify(alertMetrics).recordFallbackStored();
    }

    @Test
    void shouldSkipKafkaWhileCircuitIsOpen() {
        // Given - two failures open the circuit
        when(kafkaTemplate.send(any(), any(), any())).thenReturn(failed());
        publisher.publish(notification(UUID.randomUUID()));
        publisher.publish(notification(UUID.randomUUID()));
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        // When
        publisher.publish(notification(UUID.randomUUID()));

        // Then
        verify(kafkaTemplate, times(2)).send(any(), any(), any());
        verify(fallbackRepository, times(3)).save(any());
    }

    @Test
    void shouldNotThrowWhenFallbackStoreFails() {
        when(kafkaTemplate.send(any(), any(), any())).thenReturn(failed());
        doThrow(new DataAccessResourceFailureException("db down")).when(fallbackRepository).save(any());

        assertThatCode(() -> publisher.publish(notification(UUID.randomUUID()))).doesNotThrowAnyException();
        verify(alertMetrics, never()).recordFallbackStored();
    }

    @Test
    void shouldRejectNullEvent() {
        assertThatThrownBy(() -> publisher.publish(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Event cannot be null");
        verifyNoInteractions(kafkaTemplate);
    }
}
