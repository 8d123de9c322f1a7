package com.koni.energy.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Command to acknowledge an alert event.
 */
@Getter
@AllArgsConstructor
public class AcknowledgeAlertEventCommand {

    private final UUID ownerId;
    private final Long eventId;
}
