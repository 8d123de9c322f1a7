package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.command.CreateAlertRuleCommand;
import com.koni.energy.application.command.CreateAlertRuleCommandHandler;
import com.koni.energy.application.command.DeleteAlertRuleCommand;
import com.koni.energy.application.command.DeleteAlertRuleCommandHandler;
import com.koni.energy.application.command.UpdateAlertRuleCommand;
import com.koni.energy.application.command.UpdateAlertRuleCommandHandler;
import com.koni.energy.application.evaluation.EvaluateAlertsCommand;
import com.koni.energy.application.evaluation.EvaluateAlertsCommandHandler;
import com.koni.energy.application.evaluation.EvaluationResult;
import com.koni.energy.application.query.AlertRuleResponse;
import com.koni.energy.application.query.GetAlertRuleQuery;
import com.koni.energy.application.query.GetAlertRulesQuery;
import com.koni.energy.application.query.GetAlertRulesQueryHandler;
import com.koni.energy.infrastructure.security.AuthenticatedOwner;
import com.koni.energy.infrastructure.web.dto.AlertRuleRequest;
import com.koni.energy.infrastructure.web.dto.AlertRuleUpdateRequest;
import com.koni.energy.infrastructure.web.dto.ApiMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for alert rules and evaluation passes.
 * 
 * Endpoints:
 * - GET /api/v1/alerts: List the caller's rules, newest first
 * - POST /api/v1/alerts: Create a rule
 * - GET /api/v1/alerts/{id}: Read a rule
 * - PUT /api/v1/alerts/{id}: Partially update a rule
 * - DELETE /api/v1/alerts/{id}: Delete a rule
 * - POST /api/v1/alerts/evaluate: Run an evaluation pass for the caller
 * 
 * The caller is always the owner named by the bearer token; rules of other owners
 * are reported as not found.
 */
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertRuleController {

    private final GetAlertRulesQueryHandler queryHandler;
    private final CreateAlertRuleCommandHandler createHandler;
    private final UpdateAlertRuleCommandHandler updateHandler;
    private final DeleteAlertRuleCommandHandler deleteHandler;
    private final EvaluateAlertsCommandHandler evaluateHandler;

    @GetMapping
    public ResponseEntity<List<AlertRuleResponse>> listRules(@AuthenticationPrincipal Jwt jwt) {
        UUID ownerId = AuthenticatedOwner.idOf(jwt);
        return ResponseEntity.ok(queryHandler.handle(new GetAlertRulesQuery(ownerId)));
    }

    /**
     * Example request:
     * POST /api/v1/alerts
     * {
     *   "name": "High load",
     *   "alert_type": "threshold",
     *   "metric": "power_w",
     *   "comparison": "gt",
     *   "threshold": 1000
     * }
     * 
     * @return 201 Created with the stored rule
     */
    @PostMapping
    public ResponseEntity<AlertRuleResponse> createRule(@AuthenticationPrincipal Jwt jwt,
                                                        @RequestBody @Valid AlertRuleRequest request) {
        UUID ownerId = AuthenticatedOwner.idOf(jwt);
        log.info("Received alert rule creation: ownerId={}, name='{}', kind={}", ownerId, request.getName(), request.getKind());

        CreateAlertRuleCommand command = CreateAlertRuleCommand.builder()
                .ownerId(ownerId)
                .name(request.getName())
                .kind(request.getKind())
                .deviceId(request.getDeviceId())
                .metric(request.getMetric())
                .comparison(request.getComparison())
                .threshold(request.getThreshold())
                .windowSeconds(request.getWindowSeconds())
                .severity(request.getSeverity())
                .enabled(request.getEnabled())
                .cooldownSeconds(request.getCooldownSeconds())
                .build();

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AlertRuleResponse.from(createHandler.handle(command)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertRuleResponse> getRule(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(queryHandler.handle(new GetAlertRuleQuery(AuthenticatedOwner.idOf(jwt), id)));
    }

    /**
     * Fields missing from the body stay unchanged; an explicit null clears
     * device_id, threshold or window_seconds.
     */
    @PutMapping("/{id}")
    public ResponseEntity<AlertRuleResponse> updateRule(@AuthenticationPrincipal Jwt jwt,
                                                        @PathVariable("id") UUID id,
                                                        @RequestBody AlertRuleUpdateRequest request) {
        UUID ownerId = AuthenticatedOwner.idOf(jwt);
        log.info("Received alert rule update: ownerId={}, ruleId={}", ownerId, id);
        UpdateAlertRuleCommand command = new UpdateAlertRuleCommand(ownerId, id, request.toPatch());
        return ResponseEntity.ok(AlertRuleResponse.from(updateHandler.handle(command)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiMessage> deleteRule(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") UUID id) {
        deleteHandler.handle(new DeleteAlertRuleCommand(AuthenticatedOwner.idOf(jwt), id));
        return ResponseEntity.ok(new ApiMessage("Deleted"));
    }

    /**
     * Runs one evaluation pass over the caller's enabled rules.
     * 
     * @return 200 OK with the number of triggered events, 503 if the store fails during the pass
     */
    @PostMapping("/evaluate")
    public ResponseEntity<ApiMessage> evaluate(@AuthenticationPrincipal Jwt jwt) {
        UUID ownerId = AuthenticatedOwner.idOf(jwt);
        log.info("Received evaluation request: ownerId={}", ownerId);
        EvaluationResult result = evaluateHandler.handle(new EvaluateAlertsCommand(ownerId));
        return ResponseEntity.ok(new ApiMessage(result.toMessage()));
    }
}
