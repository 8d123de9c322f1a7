package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.command.AcknowledgeAlertEventCommand;
import com.koni.energy.application.command.AcknowledgeAlertEventCommandHandler;
import com.koni.energy.application.command.ResolveAlertEventCommand;
import com.koni.energy.application.command.ResolveAlertEventCommandHandler;
import com.koni.energy.application.query.AlertEventResponse;
import com.koni.energy.application.query.GetAlertEventsQuery;
import com.koni.energy.application.query.GetAlertEventsQueryHandler;
import com.koni.energy.infrastructure.security.AuthenticatedOwner;
import com.koni.energy.infrastructure.web.dto.ApiMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the alert event log.
 * 
 * Endpoints:
 * - GET /api/v1/alerts/events: Newest events, optionally filtered by device and rule
 * - POST /api/v1/alerts/events/{id}/ack: Acknowledge an event
 * - POST /api/v1/alerts/events/{id}/resolve: Resolve an event
 */
@RestController
@RequestMapping("/api/v1/alerts/events")
@RequiredArgsConstructor
@Slf4j
public class AlertEventController {

    private final GetAlertEventsQueryHandler queryHandler;
    private final AcknowledgeAlertEventCommandHandler acknowledgeHandler;
    private final ResolveAlertEventCommandHandler resolveHandler;

    @GetMapping
    public ResponseEntity<List<AlertEventResponse>> listEvents(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(name = "device_id", required = false) UUID deviceId,
            @RequestParam(name = "alert_id", required = false) UUID ruleId,
            @RequestParam(name = "limit", defaultValue = "200") int limit) {
        GetAlertEventsQuery query = new GetAlertEventsQuery(AuthenticatedOwner.idOf(jwt), deviceId, ruleId, limit);
        return ResponseEntity.ok(queryHandler.handle(query));
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<ApiMessage> acknowledge(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") Long id) {
        acknowledgeHandler.handle(new AcknowledgeAlertEventCommand(AuthenticatedOwner.idOf(jwt), id));
        return ResponseEntity.ok(new ApiMessage("Acknowledged"));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ApiMessage> resolve(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") Long id) {
        resolveHandler.handle(new ResolveAlertEventCommand(AuthenticatedOwner.idOf(jwt), id));
        return ResponseEntity.ok(new ApiMessage("Resolved"));
    }
}
