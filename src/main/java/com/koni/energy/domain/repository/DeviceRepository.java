package com.koni.energy.domain.repository;

import com.koni.energy.domain.model.Device;

import java.util.List;
import java.util.UUID;

/**
 * Read contract on the device registry.
 */
public interface DeviceRepository {

    /**
     * @return the owner's active devices, oldest first
     */
    List<Device> findActiveByOwner(UUID ownerId);

    boolean isOwnedBy(UUID deviceId, UUID ownerId);
}
