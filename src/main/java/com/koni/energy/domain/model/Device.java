package com.koni.energy.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Device as seen by the alerting service. Owned by the device registry.
 */
@Getter
@AllArgsConstructor
public class Device {

    private final UUID id;
    private final UUID ownerId;
    private final String name;
    private final boolean active;

    @Override
    public String toString() {
        return "Device{" +
                "id=" + id +
                ", ownerId=" + ownerId +
                ", active=" + active +
                '}';
    }
}
