package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.service.FallbackReplayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for fallback notification replay.
 * 
 * Endpoints:
 * - POST /api/v1/admin/fallback/replay: Replay parked alert notifications to Kafka
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class FallbackReplayController {
    
    private final FallbackReplayService fallbackReplayService;
    
    /**
     * Example response (200 OK):
     * {
     *   "message": "Successfully replayed 5 events",
     *   "replayedCount": 5
     * }
     */
    @PostMapping("/fallback/replay")
    public ResponseEntity<Map<String, Object>> replayFallbackEvents() {
        log.info("Received request to replay fallback notifications");
        
        int replayedCount = fallbackReplayService.replayEvents();
        String message = replayedCount > 0 
                ? String.format("Successfully replayed %d events", replayedCount)
                : "No fallback events to replay";
        
        return ResponseEntity.ok(Map.of(
                "message", message,
                "replayedCount", replayedCount
        ));
    }
}
