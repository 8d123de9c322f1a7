package com.koni.energy.application.port;

import com.koni.energy.domain.event.AlertTriggered;

/**
 * Port interface for publishing alert notifications.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * that is implemented by infrastructure adapters (e.g., Kafka publisher).
 */
public interface EventPublisher {
    
    /**
     * Publishes an AlertTriggered event.
     * Implementations must not throw for broker outages; the evaluation pass that
     * produced the event has already committed it.
     * 
     * @param event the AlertTriggered event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(AlertTriggered event);
}
