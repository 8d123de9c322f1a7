package com.koni.energy.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.AlertRulePatch;
import com.koni.energy.domain.model.Comparison;
import com.koni.energy.domain.model.Severity;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;
import java.util.UUID;

/**
 * Request body for a partial rule update.
 * 
 * A field missing from the JSON stays null; a JSON null arrives as {@code Optional.empty()}
 * through Jackson's Jdk8Module.
 */
@Getter
@NoArgsConstructor
public class AlertRuleUpdateRequest {

    @JsonProperty("name")
    private Optional<String> name;

    @JsonProperty("alert_type")
    private Optional<AlertKind> kind;

    @JsonProperty("device_id")
    private Optional<UUID> deviceId;

    @JsonProperty("metric")
    private Optional<String> metric;

    @JsonProperty("comparison")
    private Optional<Comparison> comparison;

    @JsonProperty("threshold")
    private Optional<Double> threshold;

    @JsonProperty("window_seconds")
    private Optional<Integer> windowSeconds;

    @JsonProperty("severity")
    private Optional<Severity> severity;

    @JsonProperty("is_enabled")
    private Optional<Boolean> enabled;

    @JsonProperty("cooldown_seconds")
    private Optional<Integer> cooldownSeconds;

    public AlertRulePatch toPatch() {
        return AlertRulePatch.builder()
                .name(name)
                .kind(kind)
                .deviceId(deviceId)
                .metric(metric)
                .comparison(comparison)
                .threshold(threshold)
                .windowSeconds(windowSeconds)
                .severity(severity)
                .enabled(enabled)
                .cooldownSeconds(cooldownSeconds)
                .build();
    }
}
