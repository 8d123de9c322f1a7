package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA repository for alert notifications parked while Kafka is unavailable.
 */
@Repository
public interface FallbackEventJpaRepository extends JpaRepository<FallbackEventEntity, UUID> {
    
    /**
     * Oldest failures first, so that replay keeps the original publishing order.
     */
    List<FallbackEventEntity> findAllByOrderByFailedAtAsc();
}
