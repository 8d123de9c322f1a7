package com.koni.energy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Query for the most recent alert events of an owner.
 * A null device or rule id leaves that filter off.
 */
@Getter
@AllArgsConstructor
public class GetAlertEventsQuery {

    public static final int DEFAULT_LIMIT = 200;
    public static final int MAX_LIMIT = 1000;

    private final UUID ownerId;
    private final UUID deviceId;
    private final UUID ruleId;
    private final int limit;
}
