package com.koni.energy.application.evaluation;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Command to run one evaluation pass over all enabled rules of an owner.
 */
@Getter
@AllArgsConstructor
public class EvaluateAlertsCommand {

    @NotNull(message = "ownerId is required")
    private final UUID ownerId;
}
