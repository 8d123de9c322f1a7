package com.koni.energy.application.command;

import com.koni.energy.domain.model.AlertRulePatch;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Command to apply a partial update to an owner's rule.
 */
@Getter
@AllArgsConstructor
public class UpdateAlertRuleCommand {

    private final UUID ownerId;
    private final UUID ruleId;
    private final AlertRulePatch patch;
}
