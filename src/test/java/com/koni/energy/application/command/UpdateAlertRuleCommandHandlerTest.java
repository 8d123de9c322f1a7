package com.koni.energy.application.command;

import com.koni.energy.domain.exception.DuplicateAlertNameException;
import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.AlertRulePatch;
import com.koni.energy.domain.repository.AlertRuleRepository;
import com.koni.energy.domain.repository.DeviceRepository;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for UpdateAlertRuleCommandHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class UpdateAlertRuleCommandHandlerTest {

    private static final UUID OWNER = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2025-01-31T12:00:00Z");

    @Mock
    private AlertRuleRepository alertRuleRepository;

    @Mock
    private DeviceRepository deviceRepository;

    private UpdateAlertRuleCommandHandler handler;
    private AlertRule current;

    @BeforeEach
    void setUp() {
        handler = new UpdateAlertRuleCommandHandler(alertRuleRepository, new RuleDeviceGuard(deviceRepository),
                Clock.fixed(NOW, ZoneOffset.UTC));
        current = AlertRule.builder()
                .id(UUID.randomUUID())
                .ownerId(OWNER)
                .deviceId(UUID.randomUUID())
                .name("High load")
                .kind(AlertKind.THRESHOLD)
                .threshold(1000.0)
                .createdAt(NOW.minusSeconds(3600))
                .updatedAt(NOW.minusSeconds(3600))
                .build();
    }

    private UpdateAlertRuleCommand command(AlertRulePatch patch) {
        return new UpdateAlertRuleCommand(OWNER, current.getId(), patch);
    }

    @Test
    void shouldReturnRuleUnchangedForEmptyPatch() {
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));

        AlertRule result = handler.handle(command(AlertRulePatch.builder().build()));

        assertThat(result).isSameAs(current);
        verify(alertRuleRepository, never()).update(any());
    }

    @Test
    void shouldApplyPatchAndStampUpdateTime() {
        // Given
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));
        when(alertRuleRepository.update(any())).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        AlertRule result = handler.handle(command(AlertRulePatch.builder()
                .threshold(Optional.of(1500.0))
                .enabled(Optional.of(false))
                .build()));

        // Then
        assertThat(result.getThreshold()).isEqualTo(1500.0);
        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getName()).isEqualTo("High load");
        assertThat(result.getUpdatedAt()).isEqualTo(NOW);
        verifyNoInteractions(deviceRepository);
        verify(alertRuleRepository, never()).existsByName(any(), any(), any());
    }

    @Test
    void shouldReportMissingRuleAsNotFound() {
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> handler.handle(command(AlertRulePatch.builder().build())))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Alert not found");
    }

    @Test
    void shouldRecheckDeviceOwnershipWhenDeviceChanges() {
        // Given
        UUID foreignDevice = UUID.randomUUID();
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));
        when(deviceRepository.isOwnedBy(foreignDevice, OWNER)).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> handler.handle(command(AlertRulePatch.builder()
                .deviceId(Optional.of(foreignDevice)).build())))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Device not found");
        verify(alertRuleRepository, never()).update(any());
    }

    @Test
    void shouldClearDeviceScopeWithoutOwnershipCheck() {
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));
        when(alertRuleRepository.update(any())).thenAnswer(invocation -> invocation.getArgument(0));

        AlertRule result = handler.handle(command(AlertRulePatch.builder().deviceId(Optional.empty()).build()));

        assertThat(result.getDeviceId()).isNull();
        verifyNoInteractions(deviceRepository);
    }

    @Test
    void shouldRejectRenameToExistingName() {
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));
        when(alertRuleRepository.existsByName(OWNER, "Peak", current.getId())).thenReturn(true);

        assertThatThrownBy(() -> handler.handle(command(AlertRulePatch.builder().name(Optional.of("Peak")).build())))
                .isInstanceOf(DuplicateAlertNameException.class);
    }

    @Test
    void shouldNotCheckNameWhenItIsUnchanged() {
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));
        when(alertRuleRepository.update(any())).thenAnswer(invocation -> invocation.getArgument(0));

        handler.handle(command(AlertRulePatch.builder().name(Optional.of("High load")).build()));

        verify(alertRuleRepository, never()).existsByName(any(), any(), any());
    }

    @Test
    void shouldRevalidatePatchedRule() {
        // Given - clearing the threshold of a threshold rule
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));

        // When / Then
        assertThatThrownBy(() -> handler.handle(command(AlertRulePatch.builder().threshold(Optional.empty()).build())))
                .isInstanceOf(ValidationException.class);
        verify(alertRuleRepository, never()).update(any());
    }

    @Test
    void shouldRejectExplicitNullForRequiredField() {
        when(alertRuleRepository.findById(current.getId(), OWNER)).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> handler.handle(command(AlertRulePatch.builder().severity(Optional.empty()).build())))
                .isInstanceOf(ValidationException.class)
                .hasMessage("severity cannot be null");
    }
}
