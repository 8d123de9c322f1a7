package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.model.Device;
import com.koni.energy.domain.repository.DeviceRepository;
import com.koni.energy.infrastructure.persistence.entity.DeviceEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for the device registry read contract.
 */
@Component
@RequiredArgsConstructor
public class JpaDeviceRepositoryAdapter implements DeviceRepository {

    private final DeviceJpaRepository jpaRepository;

    @Override
    @Observed(name = "repository.find", contextualName = "device-find-active")
    public List<Device> findActiveByOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new IllegalArgumentException("OwnerId cannot be null");
        }
        return jpaRepository.findByOwnerIdAndActiveTrueOrderByCreatedAtAsc(ownerId).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    public boolean isOwnedBy(UUID deviceId, UUID ownerId) {
        if (deviceId == null || ownerId == null) {
            return false;
        }
        return jpaRepository.existsByIdAndOwnerId(deviceId, ownerId);
    }

    private Device toDomain(DeviceEntity entity) {
        return new Device(entity.getId(), entity.getOwnerId(), entity.getName(), entity.isActive());
    }
}
