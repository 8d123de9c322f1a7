package com.koni.energy.domain.repository;

import com.koni.energy.domain.model.AlertEvent;
import com.koni.energy.domain.model.AlertEventStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for the alert event log.
 * Events are append-only apart from the acknowledge and resolve transitions.
 */
public interface AlertEventRepository {

    /**
     * Finds the newest event of a (owner, rule, device) triple with one of the given statuses.
     *
     * @return the most recent matching event by timestamp, or empty
     */
    Optional<AlertEvent> findMostRecent(UUID ownerId, UUID ruleId, UUID deviceId, Collection<AlertEventStatus> statuses);

    /**
     * Appends an event in {@link AlertEventStatus#TRIGGERED} status.
     *
     * @return the stored event with its id
     */
    AlertEvent insertTriggered(UUID ownerId, UUID ruleId, UUID deviceId, Instant timestamp, String message, Double metricValue);

    /**
     * Marks an event acknowledged if it belongs to the owner and is still acknowledgeable.
     *
     * @return true if an event was updated
     */
    boolean acknowledge(Long eventId, UUID ownerId, Instant acknowledgedAt);

    /**
     * Marks an event resolved if it belongs to the owner and is not resolved yet.
     *
     * @return true if an event was updated
     */
    boolean resolve(Long eventId, UUID ownerId, Instant resolvedAt);

    /**
     * Lists events newest first.
     *
     * @param ownerId the owner
     * @param deviceId optional device filter
     * @param ruleId optional rule filter
     * @param limit maximum number of events
     */
    List<AlertEvent> findRecent(UUID ownerId, UUID deviceId, UUID ruleId, int limit);
}
