package com.koni.energy.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the alert event log.
 * The composite index serves the cooldown lookup (owner, rule, device, newest first).
 */
@Entity
@Table(
    name = "alert_events",
    indexes = {
        @Index(
            name = "idx_alert_events_cooldown",
            columnList = "user_id, alert_id, device_id, ts DESC"
        ),
        @Index(
            name = "idx_alert_events_user_ts",
            columnList = "user_id, ts DESC"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AlertEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID ownerId;

    @Column(name = "alert_id", nullable = false)
    private UUID ruleId;

    @Column(name = "device_id")
    private UUID deviceId;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "message", length = 500)
    private String message;

    @Column(name = "metric_value")
    private Double metricValue;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
