package com.koni.energy.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Entry of the alert event log.
 */
@Getter
@Builder
@AllArgsConstructor
public class AlertEvent {

    private final Long id;
    private final UUID ownerId;
    private final UUID ruleId;
    private final UUID deviceId;
    private final Instant timestamp;
    private final AlertEventStatus status;
    private final String message;
    private final Double metricValue;
    private final Instant acknowledgedAt;
    private final Instant resolvedAt;
    private final Instant createdAt;

    @Override
    public String toString() {
        return "AlertEvent{" +
                "id=" + id +
                ", ruleId=" + ruleId +
                ", deviceId=" + deviceId +
                ", timestamp=" + timestamp +
                ", status=" + status +
                '}';
    }
}
