package com.koni.energy.application.command;

import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Rejects rule device scopes that point at a device of another owner or at no device.
 */
@Component
@RequiredArgsConstructor
public class RuleDeviceGuard {

    private final DeviceRepository deviceRepository;

    /**
     * @throws ResourceNotFoundException if {@code deviceId} is set and not owned by {@code ownerId}
     */
    public void ensureOwnedIfSet(UUID ownerId, UUID deviceId) {
        if (deviceId == null) {
            return;
        }
        if (!deviceRepository.isOwnedBy(deviceId, ownerId)) {
            throw new ResourceNotFoundException("Device not found");
        }
    }
}
