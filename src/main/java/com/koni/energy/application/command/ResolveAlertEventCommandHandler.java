package com.koni.energy.application.command;

import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.repository.AlertEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Command handler for resolving alert events. Resolved events are final.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResolveAlertEventCommandHandler {

    private final AlertEventRepository alertEventRepository;
    private final Clock clock;

    @Transactional
    public void handle(ResolveAlertEventCommand command) {
        boolean updated = alertEventRepository.resolve(
                command.getEventId(), command.getOwnerId(), Instant.now(clock));
        if (!updated) {
            log.warn("No resolvable event: eventId={}, ownerId={}", command.getEventId(), command.getOwnerId());
            throw new ResourceNotFoundException("Event not found");
        }
        log.info("Alert event resolved: eventId={}", command.getEventId());
    }
}
