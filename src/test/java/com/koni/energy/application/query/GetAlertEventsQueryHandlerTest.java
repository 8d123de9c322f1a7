package com.koni.energy.application.query;

import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.AlertEvent;
import com.koni.energy.domain.model.AlertEventStatus;
import com.koni.energy.domain.repository.AlertEventRepository;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@UnitTest
@ExtendWith(MockitoExtension.class)
class GetAlertEventsQueryHandlerTest {

    private static final UUID OWNER = UUID.randomUUID();

    @Mock
    private AlertEventRepository alertEventRepository;

    private GetAlertEventsQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GetAlertEventsQueryHandler(alertEventRepository);
    }

    @Test
    void shouldMapEventsInRepositoryOrder() {
        // Given
        UUID deviceId = UUID.randomUUID();
        AlertEvent newer = AlertEvent.builder().id(2L).ownerId(OWNER).deviceId(deviceId)
                .timestamp(Instant.parse("2025-01-31T12:00:00Z")).status(AlertEventStatus.TRIGGERED).build();
        AlertEvent older = AlertEvent.builder().id(1L).ownerId(OWNER).deviceId(deviceId)
                .timestamp(Instant.parse("2025-01-31T11:00:00Z")).status(AlertEventStatus.ACKNOWLEDGED).build();
        when(alertEventRepository.findRecent(OWNER, deviceId, null, 200)).thenReturn(List.of(newer, older));

        // When
        List<AlertEventResponse> events = handler.handle(new GetAlertEventsQuery(OWNER, deviceId, null, 200));

        // Then
        assertThat(events).extracting(AlertEventResponse::getId).containsExactly(2L, 1L);
        assertThat(events.get(1).getStatus()).isEqualTo(AlertEventStatus.ACKNOWLEDGED);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 1001})
    void shouldRejectLimitOutOfRange(int limit) {
        assertThatThrownBy(() -> handler.handle(new GetAlertEventsQuery(OWNER, null, null, limit)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("limit");
        verifyNoInteractions(alertEventRepository);
    }

    @Test
    void shouldAcceptLimitBounds() {
        when(alertEventRepository.findRecent(OWNER, null, null, 1)).thenReturn(List.of());
        when(alertEventRepository.findRecent(OWNER, null, null, 1000)).thenReturn(List.of());

        assertThat(handler.handle(new GetAlertEventsQuery(OWNER, null, null, 1))).isEmpty();
        assertThat(handler.handle(new GetAlertEventsQuery(OWNER, null, null, 1000))).isEmpty();
    }
}
