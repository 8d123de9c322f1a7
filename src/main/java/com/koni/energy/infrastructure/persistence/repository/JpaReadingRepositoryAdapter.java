package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.model.Reading;
import com.koni.energy.domain.repository.ReadingRepository;
import com.koni.energy.infrastructure.persistence.entity.EnergyReadingEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * JPA adapter for the reading store read contract.
 */
@Component
@RequiredArgsConstructor
public class JpaReadingRepositoryAdapter implements ReadingRepository {

    private final EnergyReadingJpaRepository jpaRepository;

    @Override
    @Observed(name = "repository.find", contextualName = "reading-find-latest")
    public Optional<Reading> findLatest(UUID ownerId, UUID deviceId) {
        if (ownerId == null || deviceId == null) {
            throw new IllegalArgumentException("OwnerId and deviceId are required");
        }
        return jpaRepository.findFirstByOwnerIdAndDeviceIdOrderByTimestampDesc(ownerId, deviceId)
            .map(this::toDomain);
    }

    private Reading toDomain(EnergyReadingEntity entity) {
        return new Reading(
            entity.getDeviceId(),
            entity.getTimestamp(),
            entity.getPowerW(),
            entity.getVoltageV(),
            entity.getCurrentA(),
            entity.getEnergyWh(),
            entity.getSource()
        );
    }
}
