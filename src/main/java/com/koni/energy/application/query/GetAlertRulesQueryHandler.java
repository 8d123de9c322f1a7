package com.koni.energy.application.query;

import com.koni.energy.domain.exception.ResourceNotFoundException;
import com.koni.energy.domain.repository.AlertRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for reading alert rules.
 * This handler implements the read side of the CQRS pattern for rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetAlertRulesQueryHandler {

    private final AlertRuleRepository alertRuleRepository;

    /**
     * @return the owner's rules, newest first, or an empty list
     */
    @Transactional(readOnly = true)
    public List<AlertRuleResponse> handle(GetAlertRulesQuery query) {
        List<AlertRuleResponse> rules = alertRuleRepository.findAllByOwner(query.getOwnerId()).stream()
                .map(AlertRuleResponse::from)
                .collect(Collectors.toList());
        log.debug("Retrieved {} alert rules: ownerId={}", rules.size(), query.getOwnerId());
        return rules;
    }

    /**
     * @throws ResourceNotFoundException if the rule does not exist for this owner
     */
    @Transactional(readOnly = true)
    public AlertRuleResponse handle(GetAlertRuleQuery query) {
        return alertRuleRepository.findById(query.getRuleId(), query.getOwnerId())
                .map(AlertRuleResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found"));
    }
}
