package com.koni.energy.application.command;

import com.koni.energy.domain.exception.DuplicateAlertNameException;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.repository.AlertRuleRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Command handler for creating alert rules.
 * 
 * Responsibilities:
 * - Apply defaults and validate the rule definition
 * - Check that a device scope belongs to the owner
 * - Enforce name uniqueness per owner
 * - Persist the rule
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreateAlertRuleCommandHandler {

    private final AlertRuleRepository alertRuleRepository;
    private final RuleDeviceGuard deviceGuard;
    private final Clock clock;

    /**
     * @param command the rule definition
     * @return the stored rule
     * @throws com.koni.energy.domain.exception.ValidationException if the definition is invalid
     * @throws com.koni.energy.domain.exception.ResourceNotFoundException if the device scope is not owned by the owner
     * @throws DuplicateAlertNameException if the owner already has a rule with this name
     */
    @Transactional
    @Observed(name = "command.handler", contextualName = "create-alert-rule")
    public AlertRule handle(CreateAlertRuleCommand command) {
        Instant now = Instant.now(clock);
        AlertRule.AlertRuleBuilder builder = AlertRule.builder()
                .ownerId(command.getOwnerId())
                .name(command.getName())
                .kind(command.getKind())
                .deviceId(command.getDeviceId())
                .threshold(command.getThreshold())
                .windowSeconds(command.getWindowSeconds())
                .createdAt(now)
                .updatedAt(now);
        if (command.getMetric() != null) builder.metric(command.getMetric());
        if (command.getComparison() != null) builder.comparison(command.getComparison());
        if (command.getSeverity() != null) builder.severity(command.getSeverity());
        if (command.getEnabled() != null) builder.enabled(command.getEnabled());
        if (command.getCooldownSeconds() != null) builder.cooldownSeconds(command.getCooldownSeconds());

        AlertRule rule = builder.build();
        rule.validate();
        deviceGuard.ensureOwnedIfSet(rule.getOwnerId(), rule.getDeviceId());

        if (alertRuleRepository.existsByName(rule.getOwnerId(), rule.getName(), null)) {
            log.warn("Alert name already exists: ownerId={}, name='{}'", rule.getOwnerId(), rule.getName());
            throw new DuplicateAlertNameException("Alert name already exists");
        }

        // a concurrent write with the same name fails here with DuplicateAlertNameException
        AlertRule created = alertRuleRepository.create(rule);
        log.info("Alert rule created: id={}, ownerId={}, kind={}", created.getId(), created.getOwnerId(), created.getKind());
        return created;
    }
}
