package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA repository over the device registry table.
 */
@Repository
public interface DeviceJpaRepository extends JpaRepository<DeviceEntity, UUID> {

    List<DeviceEntity> findByOwnerIdAndActiveTrueOrderByCreatedAtAsc(UUID ownerId);

    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);
}
