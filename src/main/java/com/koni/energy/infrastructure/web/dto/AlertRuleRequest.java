package com.koni.energy.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.Comparison;
import com.koni.energy.domain.model.Severity;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request body for creating an alert rule.
 * 
 * Only name and alert_type are required; the remaining attributes fall back to
 * the rule defaults (power_w, gt, medium, enabled, 300 s cooldown).
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleRequest {

    @NotBlank(message = "name is required")
    @Size(max = 200, message = "name must be at most 200 characters")
    private String name;

    @NotNull(message = "alert_type is required")
    @JsonProperty("alert_type")
    private AlertKind kind;

    @JsonProperty("device_id")
    private UUID deviceId;

    private String metric;
    private Comparison comparison;
    private Double threshold;

    @Min(value = 1, message = "window_seconds must be at least 1")
    @JsonProperty("window_seconds")
    private Integer windowSeconds;

    private Severity severity;

    @JsonProperty("is_enabled")
    private Boolean enabled;

    @Min(value = 0, message = "cooldown_seconds must not be negative")
    @JsonProperty("cooldown_seconds")
    private Integer cooldownSeconds;
}
