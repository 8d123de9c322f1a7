package com.koni.energy.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for alert rule definitions.
 * Enumerated attributes are stored as their lowercase codes.
 */
@Entity
@Table(
    name = "alerts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_alerts_user_name", columnNames = {"user_id", "name"})
    },
    indexes = {
        @Index(name = "idx_alerts_user_enabled", columnList = "user_id, is_enabled")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID ownerId;

    @Column(name = "device_id")
    private UUID deviceId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "alert_type", nullable = false, length = 16)
    private String alertType;

    @Column(name = "metric", nullable = false, length = 64)
    private String metric;

    @Column(name = "comparison", nullable = false, length = 8)
    private String comparison;

    @Column(name = "threshold")
    private Double threshold;

    @Column(name = "window_seconds")
    private Integer windowSeconds;

    @Column(name = "severity", nullable = false, length = 16)
    private String severity;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "cooldown_seconds", nullable = false)
    private int cooldownSeconds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }
}
