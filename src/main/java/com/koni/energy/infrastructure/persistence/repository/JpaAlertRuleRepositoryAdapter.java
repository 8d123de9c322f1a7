package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.exception.DuplicateAlertNameException;
import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.Comparison;
import com.koni.energy.domain.model.Severity;
import com.koni.energy.domain.repository.AlertRuleRepository;
import com.koni.energy.infrastructure.persistence.entity.AlertRuleEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for AlertRuleRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * It handles mapping between domain models (AlertRule) and JPA entities (AlertRuleEntity),
 * including the lowercase codes used for enumerated columns.
 */
@Component
@RequiredArgsConstructor
public class JpaAlertRuleRepositoryAdapter implements AlertRuleRepository {

    static final String NAME_CONSTRAINT = "uq_alerts_user_name";

    private final AlertRuleJpaRepository jpaRepository;

    @Override
    @Observed(name = "repository.find", contextualName = "alert-rule-find-enabled")
    public List<AlertRule> findEnabledByOwner(UUID ownerId) {
        requireOwner(ownerId);
        return jpaRepository.findByOwnerIdAndEnabledTrueOrderByCreatedAtAsc(ownerId).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    public List<AlertRule> findAllByOwner(UUID ownerId) {
        requireOwner(ownerId);
        return jpaRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<AlertRule> findById(UUID ruleId, UUID ownerId) {
        requireOwner(ownerId);
        if (ruleId == null) {
            throw new IllegalArgumentException("RuleId cannot be null");
        }
        return jpaRepository.findByIdAndOwnerId(ruleId, ownerId)
            .map(this::toDomain);
    }

    @Override
    public boolean existsByName(UUID ownerId, String name, UUID excludedRuleId) {
        requireOwner(ownerId);
        if (excludedRuleId == null) {
            return jpaRepository.existsByOwnerIdAndName(ownerId, name);
        }
        return jpaRepository.existsByOwnerIdAndNameAndIdNot(ownerId, name, excludedRuleId);
    }

    @Override
    @Observed(name = "repository.save", contextualName = "alert-rule-create")
    public AlertRule create(AlertRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("AlertRule cannot be null");
        }
        AlertRuleEntity entity = toEntity(rule);
        entity.setId(null);
        return saveAndFlush(entity);
    }

    @Override
    @Observed(name = "repository.save", contextualName = "alert-rule-update")
    public AlertRule update(AlertRule rule) {
        if (rule == null || rule.getId() == null) {
            throw new IllegalArgumentException("AlertRule with id is required");
        }
        return saveAndFlush(toEntity(rule));
    }

    /**
     * Only a violation of the per-owner name constraint is reported as a duplicate name;
     * any other integrity violation propagates unchanged.
     */
    private AlertRule saveAndFlush(AlertRuleEntity entity) {
        try {
            return toDomain(jpaRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            if (violatesNameConstraint(e)) {
                throw new DuplicateAlertNameException("Alert name already exists", e);
            }
            throw e;
        }
    }

    static boolean violatesNameConstraint(DataIntegrityViolationException e) {
        String detail = e.getMostSpecificCause().getMessage();
        return detail != null && detail.toLowerCase(Locale.ROOT).contains(NAME_CONSTRAINT);
    }

    @Override
    @Transactional
    public boolean delete(UUID ruleId, UUID ownerId) {
        requireOwner(ownerId);
        return jpaRepository.deleteByIdAndOwnerId(ruleId, ownerId) > 0;
    }

    @Override
    public boolean lockForEvaluation(UUID ruleId, UUID ownerId) {
        requireOwner(ownerId);
        return jpaRepository.lockByIdAndOwnerId(ruleId, ownerId).isPresent();
    }

    private static void requireOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new IllegalArgumentException("OwnerId cannot be null");
        }
    }

    private AlertRule toDomain(AlertRuleEntity entity) {
        return AlertRule.builder()
            .id(entity.getId())
            .ownerId(entity.getOwnerId())
            .deviceId(entity.getDeviceId())
            .name(entity.getName())
            .kind(AlertKind.fromCode(entity.getAlertType()))
            .metric(entity.getMetric())
            .comparison(Comparison.fromCode(entity.getComparison()))
            .threshold(entity.getThreshold())
            .windowSeconds(entity.getWindowSeconds())
            .severity(Severity.fromCode(entity.getSeverity()))
            .enabled(entity.isEnabled())
            .cooldownSeconds(entity.getCooldownSeconds())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }

    private AlertRuleEntity toEntity(AlertRule rule) {
        return new AlertRuleEntity(
            rule.getId(),
            rule.getOwnerId(),
            rule.getDeviceId(),
            rule.getName(),
            rule.getKind().code(),
            rule.getMetric(),
            rule.getComparison().code(),
            rule.getThreshold(),
            rule.getWindowSeconds(),
            rule.getSeverity().code(),
            rule.isEnabled(),
            rule.getCooldownSeconds(),
            rule.getCreatedAt(),
            rule.getUpdatedAt()
        );
    }
}
