package com.koni.energy.application.command;

import com.koni.energy.domain.exception.DuplicateAlertNameException;
import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.Comparison;
import com.koni.energy.domain.model.Severity;
import com.koni.energy.domain.repository.AlertRuleRepository;
import com.koni.energy.domain.repository.DeviceRepository;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CreateAlertRuleCommandHandler.
 * Tests defaults, validation, device ownership and name uniqueness.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class CreateAlertRuleCommandHandlerTest {

    private static final UUID OWNER = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2025-01-31T12:00:00Z");

    @Mock
    private AlertRuleRepository alertRuleRepository;

    @Mock
    private DeviceRepository deviceRepository;

    private CreateAlertRuleCommandHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CreateAlertRuleCommandHandler(alertRuleRepository, new RuleDeviceGuard(deviceRepository),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateRuleWithDefaults() {
        // Given
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER)
                .name("High load")
                .kind(AlertKind.THRESHOLD)
                .threshold(1000.0)
                .build();
        when(alertRuleRepository.existsByName(OWNER, "High load", null)).thenReturn(false);
        when(alertRuleRepository.create(any())).thenAnswer(invocation -> {
            AlertRule rule = invocation.getArgument(0);
            return rule.toBuilder().id(UUID.randomUUID()).build();
        });

        // When
        AlertRule created = handler.handle(command);

        // Then
        assertThat(created.getId()).isNotNull();
        assertThat(created.getMetric()).isEqualTo("power_w");
        assertThat(created.getComparison()).isEqualTo(Comparison.GT);
        assertThat(created.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(created.isEnabled()).isTrue();
        assertThat(created.getCooldownSeconds()).isEqualTo(300);
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        verifyNoInteractions(deviceRepository);
    }

    @Test
    void shouldKeepExplicitAttributes() {
        // Given
        UUID deviceId = UUID.randomUUID();
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER)
                .name("Low voltage")
                .kind(AlertKind.THRESHOLD)
                .deviceId(deviceId)
                .metric("voltage_v")
                .comparison(Comparison.LT)
                .threshold(210.0)
                .severity(Severity.CRITICAL)
                .enabled(false)
                .cooldownSeconds(0)
                .build();
        when(deviceRepository.isOwnedBy(deviceId, OWNER)).thenReturn(true);
        when(alertRuleRepository.create(any())).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        handler.handle(command);

        // Then
        ArgumentCaptor<AlertRule> captor = ArgumentCaptor.forClass(AlertRule.class);
        verify(alertRuleRepository).create(captor.capture());
        AlertRule stored = captor.getValue();
        assertThat(stored.getDeviceId()).isEqualTo(deviceId);
        assertThat(stored.getMetric()).isEqualTo("voltage_v");
        assertThat(stored.getComparison()).isEqualTo(Comparison.LT);
        assertThat(stored.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(stored.isEnabled()).isFalse();
        assertThat(stored.getCooldownSeconds()).isZero();
    }

    @Test
    void shouldRejectDeviceOfAnotherOwner() {
        // Given
        UUID foreignDevice = UUID.randomUUID();
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER).name("Offline").kind(AlertKind.OFFLINE).deviceId(foreignDevice).build();
        when(deviceRepository.isOwnedBy(foreignDevice, OWNER)).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Device not found");
        verify(alertRuleRepository, never()).create(any());
    }

    @Test
    void shouldRejectDuplicateName() {
        // Given
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER).name("High load").kind(AlertKind.THRESHOLD).threshold(1.0).build();
        when(alertRuleRepository.existsByName(OWNER, "High load", null)).thenReturn(true);

        // When / Then
        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(DuplicateAlertNameException.class)
                .hasMessage("Alert name already exists");
        verify(alertRuleRepository, never()).create(any());
    }

    @Test
    void shouldPropagateDuplicateNameFromConcurrentCreate() {
        // Given - another request created the same name after the existence check
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER).name("High load").kind(AlertKind.THRESHOLD).threshold(1.0).build();
        when(alertRuleRepository.existsByName(OWNER, "High load", null)).thenReturn(false);
        when(alertRuleRepository.create(any())).thenThrow(new DuplicateAlertNameException("Alert name already exists"));

        // When / Then
        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(DuplicateAlertNameException.class);
    }

    @Test
    void shouldRejectMetricLongerThanColumn() {
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER).name("High load").kind(AlertKind.THRESHOLD).threshold(1.0)
                .metric("m".repeat(100)).build();

        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(ValidationException.class)
                .hasMessage("metric must be at most 64 characters");
        verifyNoInteractions(alertRuleRepository, deviceRepository);
    }

    @Test
    void shouldRejectThresholdRuleWithoutThreshold() {
        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(OWNER).name("High load").kind(AlertKind.THRESHOLD).build();

        assertThatThrownBy(() -> handler.handle(command))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("threshold");
        verifyNoInteractions(alertRuleRepository, deviceRepository);
    }
}
