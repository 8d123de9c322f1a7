package com.koni.energy.domain.repository;

import com.koni.energy.domain.model.AlertRule;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for AlertRule persistence operations.
 * Every operation is scoped to an owner; a rule of another owner behaves as if it did not exist.
 *
 * Following Hexagonal Architecture principles, this interface is implemented
 * by infrastructure adapters (e.g., JPA repositories).
 */
public interface AlertRuleRepository {

    /**
     * Retrieves the enabled rules of an owner, oldest first.
     *
     * @param ownerId the owner
     * @return enabled rules, or an empty list
     */
    List<AlertRule> findEnabledByOwner(UUID ownerId);

    /**
     * Retrieves all rules of an owner, newest first.
     *
     * @param ownerId the owner
     * @return rules, or an empty list
     */
    List<AlertRule> findAllByOwner(UUID ownerId);

    Optional<AlertRule> findById(UUID ruleId, UUID ownerId);

    /**
     * Checks whether the owner already uses a rule name.
     *
     * @param ownerId the owner
     * @param name the candidate name
     * @param excludedRuleId rule to ignore (the one being renamed), may be null
     * @return true if another rule of the owner has this name
     */
    boolean existsByName(UUID ownerId, String name, UUID excludedRuleId);

    /**
     * Inserts a new rule.
     *
     * @param rule the rule without id
     * @return the stored rule with id and timestamps
     * @throws com.koni.energy.domain.exception.DuplicateAlertNameException if the owner already has the name
     */
    AlertRule create(AlertRule rule);

    /**
     * Replaces the stored attributes of an existing rule.
     *
     * @param rule the rule with id
     * @return the stored rule
     * @throws com.koni.energy.domain.exception.DuplicateAlertNameException if the owner already has the name
     */
    AlertRule update(AlertRule rule);

    /**
     * @return true if a rule was deleted
     */
    boolean delete(UUID ruleId, UUID ownerId);

    /**
     * Locks the rule row until the current transaction ends.
     * Evaluation takes this lock before its cooldown check so that concurrent passes
     * cannot both insert an event for the same rule within one cooldown window.
     *
     * @return true if the rule still exists
     */
    boolean lockForEvaluation(UUID ruleId, UUID ownerId);
}
