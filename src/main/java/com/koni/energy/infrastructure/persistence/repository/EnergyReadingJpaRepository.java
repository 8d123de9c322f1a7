package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.EnergyReadingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * JPA repository over the reading store table.
 */
@Repository
public interface EnergyReadingJpaRepository extends JpaRepository<EnergyReadingEntity, Long> {

    Optional<EnergyReadingEntity> findFirstByOwnerIdAndDeviceIdOrderByTimestampDesc(UUID ownerId, UUID deviceId);
}
