package com.koni.energy.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.AlertEvent;
import com.koni.energy.domain.model.AlertEventStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Data Transfer Object representing an entry of the alert event log.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AlertEventResponse {

    private Long id;

    @JsonProperty("user_id")
    private UUID ownerId;

    @JsonProperty("alert_id")
    private UUID ruleId;

    @JsonProperty("device_id")
    private UUID deviceId;

    @JsonProperty("ts")
    private Instant timestamp;

    private AlertEventStatus status;
    private String message;

    @JsonProperty("metric_value")
    private Double metricValue;

    @JsonProperty("acknowledged_at")
    private Instant acknowledgedAt;

    @JsonProperty("resolved_at")
    private Instant resolvedAt;

    @JsonProperty("created_at")
    private Instant createdAt;

    public static AlertEventResponse from(AlertEvent event) {
        return new AlertEventResponse(
                event.getId(),
                event.getOwnerId(),
                event.getRuleId(),
                event.getDeviceId(),
                event.getTimestamp(),
                event.getStatus(),
                event.getMessage(),
                event.getMetricValue(),
                event.getAcknowledgedAt(),
                event.getResolvedAt(),
                event.getCreatedAt()
        );
    }
}
