package com.koni.energy.application.command;

import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.repository.AlertRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Command handler for deleting alert rules. Events of the rule stay in the event log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteAlertRuleCommandHandler {

    private final AlertRuleRepository alertRuleRepository;

    @Transactional
    public void handle(DeleteAlertRuleCommand command) {
        if (!alertRuleRepository.delete(command.getRuleId(), command.getOwnerId())) {
            throw new ResourceNotFoundException("Alert not found");
        }
        log.info("Alert rule deleted: id={}, ownerId={}", command.getRuleId(), command.getOwnerId());
    }
}
