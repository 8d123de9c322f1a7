package com.koni.energy.domain.repository;

import com.koni.energy.domain.model.Reading;

import java.util.Optional;
import java.util.UUID;

/**
 * Read contract on the reading store.
 */
public interface ReadingRepository {

    /**
     * Finds the reading with the latest timestamp for a device of the owner.
     *
     * @return the latest reading, or empty if the device never reported
     */
    Optional<Reading> findLatest(UUID ownerId, UUID deviceId);
}
