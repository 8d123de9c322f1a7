package com.koni.energy.domain.repository;

import com.koni.energy.infrastructure.persistence.entity.FallbackEventEntity;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for alert notifications that could not be published to Kafka.
 * 
 * Notifications are stored when the circuit breaker is open or a publish fails,
 * and replayed once Kafka accepts messages again.
 */
public interface FallbackEventRepository {
    
    /**
     * Persists a fallback notification.
     * 
     * @param event the fallback event entity to save
     * @throws IllegalArgumentException if event is null
     */
    void save(FallbackEventEntity event);
    
    /**
     * Retrieves all fallback notifications, oldest failure first.
     * 
     * @return list of all fallback events, empty list if none exist
     */
    List<FallbackEventEntity> findAll();
    
    /**
     * Deletes a fallback notification after it has been replayed.
     * 
     * @param eventId the notification's event id
     * @throws IllegalArgumentException if eventId is null
     */
    void delete(UUID eventId);
}
