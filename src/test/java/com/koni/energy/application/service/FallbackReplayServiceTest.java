package com.koni.energy.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.koni.energy.domain.event.AlertTriggered;
import com.koni.energy.domain.repository.FallbackEventRepository;
import com.koni.energy.infrastructure.observability.AlertMetrics;
import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;
import com.koni.energy.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FallbackReplayService.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class FallbackReplayServiceTest {

    private static final String TOPIC = "alerts.triggered";

    @Mock
    private FallbackEventRepository fallbackRepository;

    @Mock
    private KafkaTemplate<String, AlertTriggered> kafkaTemplate;

    @Mock
    private AlertMetrics alertMetrics;

    private CircuitBreaker circuitBreaker;
    private ObjectMapper objectMapper;
    private FallbackReplayService service;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("kafka");
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        service = new FallbackReplayService(fallbackRepository, kafkaTemplate, circuitBreaker,
                objectMapper, alertMetrics, TOPIC);
    }

    private FallbackEventEntity parked(AlertTriggered event) throws Exception {
        return new FallbackEventEntity(event.getEventId(), event.getDeviceId(),
                objectMapper.writeValueAsString(event), Instant.now());
    }

    private AlertTriggered notification() {
        return new AlertTriggered(UUID.randomUUID(), 5L, UUID.randomUUID(), UUID.randomUUID(), "Offline",
                "offline", "high", UUID.randomUUID(), "Device offline (no reading within 900s)", null,
                Instant.parse("2025-01-31T12:00:00Z"));
    }

    private CompletableFuture<SendResult<String, AlertTriggered>> sent(AlertTriggered event) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, event), metadata));
    }

    @Test
    void shouldReplayAndDeleteParkedNotifications() throws Exception {
        // Given
        AlertTriggered first = notification();
        AlertTriggered second = notification();
        when(fallbackRepository.findAll()).thenReturn(List.of(parked(first), parked(second)));
        when(kafkaTemplate.send(eq(TOPIC), any(), any())).thenAnswer(invocation -> sent(invocation.getArgument(2)));

        // When
        int replayed = service.replayEvents();

        // Then
        assertThat(replayed).isEqualTo(2);
        verify(kafkaTemplate).send(TOPIC, first.getDeviceId().toString(), first);
        verify(fallbackRepository).delete(first.getEventId());
        verify(fallbackRepository).delete(second.getEventId());
        verify(alertMetrics, times(2)).recordFallbackReplayed();
    }

    @Test
    void shouldKeepNotificationThatFailsToPublish() throws Exception {
        // Given
        AlertTriggered event = notification();
        when(fallbackRepository.findAll()).thenReturn(List.of(parked(event)));
        CompletableFuture<SendResult<String, AlertTriggered>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new RuntimeException("broker down"));
        when(kafkaTemplate.send(any(), any(), any())).thenReturn(failed);

        // When
        int replayed = service.replayEvents();

        // Then
        assertThat(replayed).isZero();
        verify(fallbackRepository, never()).delete(any());
    }

    @Test
    void shouldNotReplayWhileCircuitIsOpen() {
        circuitBreaker.transitionToOpenState();

        assertThat(service.replayEvents()).isZero();
        verifyNoInteractions(fallbackRepository, kafkaTemplate);
    }

    @Test
    void shouldReturnZeroWhenNothingIsParked() {
        when(fallbackRepository.findAll()).thenReturn(List.of());

        assertThat(service.replayEvents()).isZero();
        verifyNoInteractions(kafkaTemplate);
    }
}
