package com.koni.energy.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * AlertTriggered domain event.
 * Published after an evaluation pass has committed a triggered alert event,
 * so that notification channels can react without polling the event log.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AlertTriggered {

    private final UUID eventId;
    private final Long alertEventId;
    private final UUID ownerId;
    private final UUID ruleId;
    private final String ruleName;
    private final String kind;
    private final String severity;
    private final UUID deviceId;
    private final String message;
    private final Double metricValue;
    private final Instant triggeredAt;

    @JsonCreator
    public AlertTriggered(
            @JsonProperty("eventId") UUID eventId,
            @JsonProperty("alertEventId") Long alertEventId,
            @JsonProperty("ownerId") UUID ownerId,
            @JsonProperty("ruleId") UUID ruleId,
            @JsonProperty("ruleName") String ruleName,
            @JsonProperty("kind") String kind,
            @JsonProperty("severity") String severity,
            @JsonProperty("deviceId") UUID deviceId,
            @JsonProperty("message") String message,
            @JsonProperty("metricValue") Double metricValue,
            @JsonProperty("triggeredAt") Instant triggeredAt) {
        this.eventId = eventId;
        this.alertEventId = alertEventId;
        this.ownerId = ownerId;
        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.kind = kind;
        this.severity = severity;
        this.deviceId = deviceId;
        this.message = message;
        this.metricValue = metricValue;
        this.triggeredAt = triggeredAt;
    }
}
