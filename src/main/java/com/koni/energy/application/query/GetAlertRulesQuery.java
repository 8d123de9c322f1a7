package com.koni.energy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Query for all rules of an owner, newest first.
 */
@Getter
@AllArgsConstructor
public class GetAlertRulesQuery {

    private final UUID ownerId;
}
