package com.baton.dispatch.api;

import com.baton.core.engine.CoordinationEngine;
import com.baton.core.model.TicketEvent;
import com.baton.core.model.TicketEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Webhook receiving ticket-store automation triggers.
 */
@RestController
@RequestMapping("/api/v1/events")
public class TicketEventController {

    private static final Logger log = LoggerFactory.getLogger(TicketEventController.class);

    private final CoordinationEngine engine;

    public TicketEventController(CoordinationEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> receive(@RequestBody TicketEventRequest request) {
        TicketEventType type;
        try {
            type = TicketEventType.valueOf(request.type());
        } catch (IllegalArgumentException | NullPointerException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown event type: " + request.type()));
        }
        if (request.issueId() == null || request.issueId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "issue_id is required"));
        }
        if (type == TicketEventType.COMMENT_CREATED && request.commentId() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "comment_id is required for COMMENT_CREATED"));
        }

        log.debug("Received {} on {} from {}", type, request.issueId(), request.actor());
        engine.handle(new TicketEvent(type, request.issueId(), request.actor(), request.commentId(), request.label()));
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "type", type.name()));
    }
}
