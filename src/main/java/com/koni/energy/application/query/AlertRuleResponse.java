package com.koni.energy.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.AlertRule;
import com.koni.energy.domain.model.Comparison;
import com.koni.energy.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Data Transfer Object representing an alert rule as returned by the REST API.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleResponse {

    private UUID id;

    @JsonProperty("user_id")
    private UUID ownerId;

    @JsonProperty("device_id")
    private UUID deviceId;

    private String name;

    @JsonProperty("alert_type")
    private AlertKind kind;

    private String metric;
    private Comparison comparison;
    private Double threshold;

    @JsonProperty("window_seconds")
    private Integer windowSeconds;

    private Severity severity;

    @JsonProperty("is_enabled")
    private boolean enabled;

    @JsonProperty("cooldown_seconds")
    private int cooldownSeconds;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public static AlertRuleResponse from(AlertRule rule) {
        return new AlertRuleResponse(
                rule.getId(),
                rule.getOwnerId(),
                rule.getDeviceId(),
                rule.getName(),
                rule.getKind(),
                rule.getMetric(),
                rule.getComparison(),
                rule.getThreshold(),
                rule.getWindowSeconds(),
                rule.getSeverity(),
                rule.isEnabled(),
                rule.getCooldownSeconds(),
                rule.getCreatedAt(),
                rule.getUpdatedAt()
        );
    }
}
