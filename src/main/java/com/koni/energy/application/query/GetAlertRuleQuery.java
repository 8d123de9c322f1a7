package com.koni.energy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Query for a single rule of an owner.
 */
@Getter
@AllArgsConstructor
public class GetAlertRuleQuery {

    private final UUID ownerId;
    private final UUID ruleId;
}
