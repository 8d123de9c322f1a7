package com.koni.energy.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for alert notifications that could not be published to Kafka.
 * The payload column holds the serialized AlertTriggered message.
 */
@Entity
@Table(
    name = "fallback_events",
    indexes = {
        @Index(
            name = "idx_fallback_events_failed_at",
            columnList = "failed_at DESC"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FallbackEventEntity {

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(name = "device_id", nullable = false)
    private UUID deviceId;

    @Column(name = "payload", nullable = false, length = 4000)
    private String payload;

    @Column(name = "failed_at", nullable = false, updatable = false)
    private Instant failedAt;

    @PrePersist
    protected void onCreate() {
        if (failedAt == null) {
            failedAt = Instant.now();
        }
    }
}
