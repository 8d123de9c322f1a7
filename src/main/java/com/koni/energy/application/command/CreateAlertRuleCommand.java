package com.koni.energy.application.command;

import com.koni.energy.domain.model.AlertKind;
import com.koni.energy.domain.model.Comparison;
import com.koni.energy.domain.model.Severity;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

/**
 * Command to create an alert rule for an owner.
 * Null optional attributes fall back to the rule defaults.
 */
@Getter
@Builder
public class CreateAlertRuleCommand {

    @NotNull(message = "ownerId is required")
    private final UUID ownerId;

    private final String name;
    private final AlertKind kind;
    private final UUID deviceId;
    private final String metric;
    private final Comparison comparison;
    private final Double threshold;
    private final Integer windowSeconds;
    private final Severity severity;
    private final Boolean enabled;
    private final Integer cooldownSeconds;
}
