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
 * Command handler for acknowledging alert events.
 * 
 * Only triggered or suppressed events can be acknowledged. Acknowledging an event a
 * second time, or an event of another owner, is reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AcknowledgeAlertEventCommandHandler {

    private final AlertEventRepository alertEventRepository;
    private final Clock clock;

    @Transactional
    public void handle(AcknowledgeAlertEventCommand command) {
        boolean updated = alertEventRepository.acknowledge(
                command.getEventId(), command.getOwnerId(), Instant.now(clock));
        if (!updated) {
            log.warn("No acknowledgeable event: eventId={}, ownerId={}", command.getEventId(), command.getOwnerId());
            throw new ResourceNotFoundException("Event not found");
        }
        log.info("Alert event acknowledged: eventId={}", command.getEventId());
    }
}
