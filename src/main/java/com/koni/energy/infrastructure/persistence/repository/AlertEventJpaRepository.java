package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.AlertEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA repository for AlertEventEntity persistence operations.
 *
 * Status transitions are single conditional UPDATE statements, so an event that is
 * no longer in a matching status is left untouched and reported as zero rows.
 */
@Repository
public interface AlertEventJpaRepository extends JpaRepository<AlertEventEntity, Long>,
        JpaSpecificationExecutor<AlertEventEntity> {

    /**
     * Finds the newest event for the cooldown check.
     */
    Optional<AlertEventEntity> findFirstByOwnerIdAndRuleIdAndDeviceIdAndStatusInOrderByTimestampDesc(
            UUID ownerId, UUID ruleId, UUID deviceId, Collection<String> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AlertEventEntity e SET e.status = 'acknowledged', e.acknowledgedAt = :at "
            + "WHERE e.id = :id AND e.ownerId = :ownerId AND e.status IN :statuses")
    int acknowledge(@Param("id") Long id,
                    @Param("ownerId") UUID ownerId,
                    @Param("at") Instant acknowledgedAt,
                    @Param("statuses") Collection<String> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AlertEventEntity e SET e.status = 'resolved', e.resolvedAt = :at "
            + "WHERE e.id = :id AND e.ownerId = :ownerId AND e.status IN :statuses")
    int resolve(@Param("id") Long id,
                @Param("ownerId") UUID ownerId,
                @Param("at") Instant resolvedAt,
                @Param("statuses") Collection<String> statuses);
}
