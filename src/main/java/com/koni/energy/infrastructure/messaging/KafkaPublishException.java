package com.koni.energy.infrastructure.messaging;

/**
 * Raised when a notification could not be handed to Kafka.
 * Counted as a failure by the circuit breaker.
 */
public class KafkaPublishException extends RuntimeException {

    public KafkaPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
