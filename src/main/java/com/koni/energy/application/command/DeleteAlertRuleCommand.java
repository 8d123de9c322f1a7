package com.koni.energy.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Command to delete an owner's rule.
 */
@Getter
@AllArgsConstructor
public class DeleteAlertRuleCommand {

    private final UUID ownerId;
    private final UUID ruleId;
}
