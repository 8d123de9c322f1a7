package com.koni.energy.application.evaluation;

import com.koni.energy.application.port.EventPublisher;
import com.koni.energy.domain.event.AlertTriggered;
import com.koni.energy.domain.exception.DatabaseUnavailableException;
import com.koni.energy.domain.model.AlertEvent;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.Device;
import com.koni.energy.domain.repository.AlertRuleRepository;
import com.koni.energy.domain.repository.DeviceRepository;
import com.koni.energy.infrastructure.observability.AlertMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Command handler for alert evaluation passes.
 *
 * Responsibilities:
 * - Load the owner's enabled rules and resolve their target devices
 * - Evaluate every (rule, device) pair through {@link AlertPairEvaluator}
 * - Publish an AlertTriggered notification for each inserted event
 * - Count inserted events
 *
 * The handler is not transactional. Every pair commits on its own and an aborted pass
 * keeps the events it already inserted. A store failure aborts the whole pass with
 * {@link DatabaseUnavailableException}; no partial count is returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluateAlertsCommandHandler {

    private final AlertRuleRepository alertRuleRepository;
    private final DeviceRepository deviceRepository;
    private final AlertPairEvaluator pairEvaluator;
    private final EventPublisher eventPublisher;
    private final AlertMetrics alertMetrics;
    private final Clock clock;

    /**
     * Runs one evaluation pass for the command's owner.
     *
     * @param command the command naming the owner
     * @return the number of inserted events
     * @throws DatabaseUnavailableException if the store fails during the pass
     */
    @Observed(name = "command.handler", contextualName = "evaluate-alerts")
    public EvaluationResult handle(EvaluateAlertsCommand command) {
        UUID ownerId = command.getOwnerId();
        if (ownerId == null) {
            throw new IllegalArgumentException("OwnerId cannot be null");
        }
        alertMetrics.recordPass();

        try {
            return alertMetrics.recordEvaluationTime(() -> evaluate(ownerId));
        } catch (DataAccessException | TransactionException e) {
            alertMetrics.recordFailure();
            log.error("Alert evaluation aborted: ownerId={}", ownerId, e);
            throw new DatabaseUnavailableException("Alert evaluation aborted: " + e.getMessage(), e);
        }
    }

    private EvaluationResult evaluate(UUID ownerId) {
        Instant now = Instant.now(clock);
        List<AlertRule> rules = alertRuleRepository.findEnabledByOwner(ownerId);
        log.debug("Evaluating {} enabled rules: ownerId={}, now={}", rules.size(), ownerId, now);

        // Loaded lazily once and shared by all unscoped rules of the pass.
        List<UUID> activeDevices = null;
        int triggered = 0;

        for (AlertRule rule : rules) {
            List<UUID> targets;
            if (rule.isScoped()) {
                targets = List.of(rule.getDeviceId());
            } else {
                if (activeDevices == null) {
                    activeDevices = deviceRepository.findActiveByOwner(ownerId).stream()
                            .map(Device::getId)
                            .collect(Collectors.toList());
                }
                targets = activeDevices;
            }

            for (UUID deviceId : targets) {
                Optional<AlertEvent> event = pairEvaluator.evaluate(rule, deviceId, now);
                if (event.isPresent()) {
                    triggered++;
                    eventPublisher.publish(toNotification(rule, event.get()));
                }
            }
        }

        log.info("Alert evaluation completed: ownerId={}, rules={}, triggered={}", ownerId, rules.size(), triggered);
        return new EvaluationResult(triggered);
    }

    private AlertTriggered toNotification(AlertRule rule, AlertEvent event) {
        return new AlertTriggered(
                UUID.randomUUID(),
                event.getId(),
                event.getOwnerId(),
                rule.getId(),
                rule.getName(),
                rule.getKind().code(),
                rule.getSeverity().code(),
                event.getDeviceId(),
                event.getMessage(),
                event.getMetricValue(),
                event.getTimestamp()
        );
    }
}
