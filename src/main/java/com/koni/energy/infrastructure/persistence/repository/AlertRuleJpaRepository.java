package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.AlertRuleEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA repository for AlertRuleEntity persistence operations.
 * All finders take the owner id so that rules never leak across owners.
 */
@Repository
public interface AlertRuleJpaRepository extends JpaRepository<AlertRuleEntity, UUID> {

    List<AlertRuleEntity> findByOwnerIdAndEnabledTrueOrderByCreatedAtAsc(UUID ownerId);

    List<AlertRuleEntity> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    Optional<AlertRuleEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    boolean existsByOwnerIdAndName(UUID ownerId, String name);

    boolean existsByOwnerIdAndNameAndIdNot(UUID ownerId, String name, UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AlertRuleEntity r WHERE r.id = :id AND r.ownerId = :ownerId")
    int deleteByIdAndOwnerId(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    /**
     * Loads the rule with a pessimistic write lock (SELECT ... FOR UPDATE).
     * The lock is held until the surrounding transaction commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AlertRuleEntity r WHERE r.id = :id AND r.ownerId = :ownerId")
    Optional<AlertRuleEntity> lockByIdAndOwnerId(@Param("id") UUID id, @Param("ownerId") UUID ownerId);
}
