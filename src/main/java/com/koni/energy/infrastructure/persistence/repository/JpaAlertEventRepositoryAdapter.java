package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.model.AlertEvent;
import com.koni.energy.domain.model.AlertEventStatus;
import com.koni.energy.domain.repository.AlertEventRepository;
import com.koni.energy.infrastructure.persistence.entity.AlertEventEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for AlertEventRepository.
 *
 * Maps between the domain AlertEvent and AlertEventEntity; statuses are stored as lowercase codes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAlertEventRepositoryAdapter implements AlertEventRepository {

    private final AlertEventJpaRepository jpaRepository;

    @Override
    @Observed(name = "repository.find", contextualName = "alert-event-most-recent")
    public Optional<AlertEvent> findMostRecent(UUID ownerId, UUID ruleId, UUID deviceId,
                                               Collection<AlertEventStatus> statuses) {
        if (ownerId == null || ruleId == null || deviceId == null) {
            throw new IllegalArgumentException("OwnerId, ruleId and deviceId are required");
        }
        return jpaRepository.findFirstByOwnerIdAndRuleIdAndDeviceIdAndStatusInOrderByTimestampDesc(
                ownerId, ruleId, deviceId, codes(statuses))
            .map(this::toDomain);
    }

    @Override
    @Observed(name = "repository.save", contextualName = "alert-event-insert")
    public AlertEvent insertTriggered(UUID ownerId, UUID ruleId, UUID deviceId, Instant timestamp,
                                      String message, Double metricValue) {
        AlertEventEntity entity = new AlertEventEntity();
        entity.setOwnerId(ownerId);
        entity.setRuleId(ruleId);
        entity.setDeviceId(deviceId);
        entity.setTimestamp(timestamp);
        entity.setStatus(AlertEventStatus.TRIGGERED.code());
        entity.setMessage(message);
        entity.setMetricValue(metricValue);

        AlertEventEntity saved = jpaRepository.saveAndFlush(entity);
        log.debug("Alert event inserted: id={}, ruleId={}, deviceId={}", saved.getId(), ruleId, deviceId);
        return toDomain(saved);
    }

    @Override
    @Transactional
    public boolean acknowledge(Long eventId, UUID ownerId, Instant acknowledgedAt) {
        return jpaRepository.acknowledge(eventId, ownerId, acknowledgedAt,
                codes(AlertEventStatus.ACKNOWLEDGEABLE)) > 0;
    }

    @Override
    @Transactional
    public boolean resolve(Long eventId, UUID ownerId, Instant resolvedAt) {
        return jpaRepository.resolve(eventId, ownerId, resolvedAt,
                codes(AlertEventStatus.RESOLVABLE)) > 0;
    }

    @Override
    @Observed(name = "repository.find", contextualName = "alert-event-recent")
    public List<AlertEvent> findRecent(UUID ownerId, UUID deviceId, UUID ruleId, int limit) {
        if (ownerId == null) {
            throw new IllegalArgumentException("OwnerId cannot be null");
        }
        Specification<AlertEventEntity> spec = ownedBy(ownerId);
        if (deviceId != null) {
            spec = spec.and(attributeEquals("deviceId", deviceId));
        }
        if (ruleId != null) {
            spec = spec.and(attributeEquals("ruleId", ruleId));
        }
        PageRequest page = PageRequest.of(0, limit,
                Sort.by(Sort.Direction.DESC, "timestamp").and(Sort.by(Sort.Direction.DESC, "id")));
        return jpaRepository.findAll(spec, page).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    private static Specification<AlertEventEntity> ownedBy(UUID ownerId) {
        return attributeEquals("ownerId", ownerId);
    }

    private static Specification<AlertEventEntity> attributeEquals(String attribute, Object value) {
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    private static List<String> codes(Collection<AlertEventStatus> statuses) {
        return statuses.stream().map(AlertEventStatus::code).collect(Collectors.toList());
    }

    private AlertEvent toDomain(AlertEventEntity entity) {
        return AlertEvent.builder()
            .id(entity.getId())
            .ownerId(entity.getOwnerId())
            .ruleId(entity.getRuleId())
            .deviceId(entity.getDeviceId())
            .timestamp(entity.getTimestamp())
            .status(AlertEventStatus.fromCode(entity.getStatus()))
            .message(entity.getMessage())
            .metricValue(entity.getMetricValue())
            .acknowledgedAt(entity.getAcknowledgedAt())
            .resolvedAt(entity.getResolvedAt())
            .createdAt(entity.getCreatedAt())
            .build();
    }
}
