package com.koni.energy.application.command;

import com.koni.energy.domain.exception.DuplicateAlertNameException;
import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.AlertRulePatch;
import com.koni.energy.domain.repository.AlertRuleRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Command handler for partial rule updates.
 * 
 * Only the attributes present in the patch are checked and changed: device ownership
 * is re-checked when the device scope is patched, and name uniqueness when the name changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpdateAlertRuleCommandHandler {

    private final AlertRuleRepository alertRuleRepository;
    private final RuleDeviceGuard deviceGuard;
    private final Clock clock;

    /**
     * @param command owner, rule and patch
     * @return the rule after the update, unchanged for an empty patch
     * @throws ResourceNotFoundException if the rule or the patched device scope is not the owner's
     * @throws DuplicateAlertNameException if the new name is taken
     */
    @Transactional
    @Observed(name = "command.handler", contextualName = "update-alert-rule")
    public AlertRule handle(UpdateAlertRuleCommand command) {
        AlertRule current = alertRuleRepository.findById(command.getRuleId(), command.getOwnerId())
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found"));

        AlertRulePatch patch = command.getPatch();
        if (patch == null || patch.isEmpty()) {
            log.debug("Empty patch for alert rule: id={}", current.getId());
            return current;
        }

        AlertRule updated = patch.applyTo(current, Instant.now(clock));
        updated.validate();

        if (patch.changedFields().contains(AlertRulePatch.Field.DEVICE_ID)) {
            deviceGuard.ensureOwnedIfSet(current.getOwnerId(), updated.getDeviceId());
        }
        if (patch.renames(current.getName())
                && alertRuleRepository.existsByName(current.getOwnerId(), updated.getName(), current.getId())) {
            log.warn("Alert name already exists: ownerId={}, name='{}'", current.getOwnerId(), updated.getName());
            throw new DuplicateAlertNameException("Alert name already exists");
        }

        AlertRule saved = alertRuleRepository.update(updated);
        log.info("Alert rule updated: id={}, fields={}", saved.getId(), patch.changedFields());
        return saved;
    }
}
