package com.koni.energy.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Command to mark an alert event resolved by hand.
 */
@Getter
@AllArgsConstructor
public class ResolveAlertEventCommand {

    private final UUID ownerId;
    private final Long eventId;
}
