package com.koni.energy.application.evaluation;

import com.koni.energy.domain.model.AlertEvent;
import com.koni.energy.domain.model.AlertEventStatus;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.AlertTrigger;
import com.koni.energy.domain.model.Reading;
import com.koni.energy.domain.repository.AlertEventRepository;
import com.koni.energy.domain.repository.AlertRuleRepository;
import com.koni.energy.domain.repository.ReadingRepository;
import com.koni.energy.infrastructure.observability.AlertMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Evaluates one rule against one device.
 *
 * Each call is its own transaction: the rule row is locked first, then the cooldown
 * check, the reading lookup and the insert run under that lock. A second pass working
 * on the same rule waits for the commit and then sees the new event in its cooldown check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertPairEvaluator {

    private final AlertRuleRepository alertRuleRepository;
    private final AlertEventRepository alertEventRepository;
    private final ReadingRepository readingRepository;
    private final AlertMetrics alertMetrics;

    /**
     * @param rule an enabled rule of the owner
     * @param deviceId a device of the same owner
     * @param now evaluation time of the pass
     * @return the inserted event, or empty if the pair is cooling down or the rule does not fire
     */
    @Transactional
    public Optional<AlertEvent> evaluate(AlertRule rule, UUID deviceId, Instant now) {
        UUID ownerId = rule.getOwnerId();

        if (!alertRuleRepository.lockForEvaluation(rule.getId(), ownerId)) {
            log.debug("Rule removed during evaluation: ruleId={}", rule.getId());
            return Optional.empty();
        }

        Optional<AlertEvent> recent = alertEventRepository.findMostRecent(
                ownerId, rule.getId(), deviceId, AlertEventStatus.COOLDOWN_STATUSES);
        if (recent.isPresent() && rule.isCoolingDown(recent.get().getTimestamp(), now)) {
            log.debug("Cooldown active: ruleId={}, deviceId={}, lastEventAt={}, cooldownSeconds={}",
                    rule.getId(), deviceId, recent.get().getTimestamp(), rule.getCooldownSeconds());
            alertMetrics.recordCooldownSuppressed();
            return Optional.empty();
        }

        Optional<Reading> latest = readingRepository.findLatest(ownerId, deviceId);
        Optional<AlertTrigger> trigger = rule.evaluate(latest, now);
        if (trigger.isEmpty()) {
            return Optional.empty();
        }

        AlertEvent event = alertEventRepository.insertTriggered(
                ownerId,
                rule.getId(),
                deviceId,
                now,
                trigger.get().getMessage(),
                trigger.get().getMetricValue()
        );
        alertMetrics.recordTriggered(rule.getKind());
        log.info("Alert triggered: eventId={}, rule='{}', deviceId={}, message='{}'",
                event.getId(), rule.getName(), deviceId, event.getMessage());
        return Optional.of(event);
    }
}
